package com.resumetailor.domain.optimization.model;

/**
 * Formatting attributes carried by a paragraph from source to output.
 * Opaque to the engine: it is copied, never merged or inspected.
 *
 * @param alignment           paragraph alignment name (e.g. LEFT, CENTER), nullable
 * @param indentationLeft     left indentation in twips, -1 if unset
 * @param indentationFirstLine first-line indentation in twips, -1 if unset
 * @param spacingBefore       spacing before in twips, -1 if unset
 * @param spacingAfter        spacing after in twips, -1 if unset
 * @param styleId             paragraph style id, nullable
 * @param bold                run-level bold of the leading run
 * @param italic              run-level italic of the leading run
 * @param underline           run-level underline pattern name, nullable
 * @param fontFamily          run-level font family, nullable
 * @param fontSize            run-level font size in points, -1 if unset
 * @param color               run-level hex color, nullable
 */
public record ParagraphFormatting(
        String alignment,
        int indentationLeft,
        int indentationFirstLine,
        int spacingBefore,
        int spacingAfter,
        String styleId,
        boolean bold,
        boolean italic,
        String underline,
        String fontFamily,
        double fontSize,
        String color
) {
    private static final ParagraphFormatting EMPTY = new ParagraphFormatting(
            null, -1, -1, -1, -1, null, false, false, null, null, -1, null);

    public static ParagraphFormatting empty() {
        return EMPTY;
    }
}
