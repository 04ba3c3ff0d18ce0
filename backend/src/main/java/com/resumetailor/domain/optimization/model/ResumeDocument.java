package com.resumetailor.domain.optimization.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable paragraph sequence read from a resume file.
 * An optimization run produces a new instance and never mutates its input.
 */
public record ResumeDocument(List<Paragraph> paragraphs) {

    public ResumeDocument {
        paragraphs = paragraphs != null ? List.copyOf(paragraphs) : List.of();
    }

    public static ResumeDocument ofTexts(String... texts) {
        return new ResumeDocument(Arrays.stream(texts).map(Paragraph::of).toList());
    }

    public int size() {
        return paragraphs.size();
    }

    public Paragraph get(int index) {
        return paragraphs.get(index);
    }

    /**
     * Non-blank paragraph texts joined by newlines.
     */
    public String fullText() {
        return paragraphs.stream()
                .map(Paragraph::text)
                .filter(t -> !t.isBlank())
                .collect(Collectors.joining("\n"));
    }

    public List<String> texts() {
        return paragraphs.stream().map(Paragraph::text).toList();
    }
}
