package com.resumetailor.domain.optimization.model;

import java.util.Objects;

/**
 * One paragraph of a resume: its text plus the formatting it must keep on output.
 */
public record Paragraph(String text, ParagraphFormatting formatting) {

    public Paragraph {
        text = text != null ? text : "";
        formatting = formatting != null ? formatting : ParagraphFormatting.empty();
    }

    public static Paragraph of(String text) {
        return new Paragraph(text, ParagraphFormatting.empty());
    }

    public boolean isBlank() {
        return text.isBlank();
    }

    /**
     * Same formatting, new text. Returns this instance when the text is unchanged.
     */
    public Paragraph withText(String newText) {
        if (Objects.equals(text, newText)) {
            return this;
        }
        return new Paragraph(newText, formatting);
    }
}
