package com.resumetailor.domain.optimization.model;

import java.util.Locale;

/**
 * A single token or 1-3 word n-gram extracted from a text.
 *
 * @param text      display form, case preserved from its first occurrence
 * @param frequency raw occurrence count in the source text
 */
public record Keyword(String text, int frequency) {

    /**
     * Case-normalized form used for every comparison.
     */
    public String key() {
        return text.toLowerCase(Locale.ROOT);
    }

    public int wordCount() {
        return text.strip().split("\\s+").length;
    }

    public boolean isTechnical() {
        return TechnicalVocabulary.isTechnical(text);
    }
}
