package com.resumetailor.domain.optimization.model;

/**
 * Outcome of one insertion attempt.
 *
 * @param text     paragraph text after the attempt (unchanged when not inserted)
 * @param inserted true if the keyword was added
 */
public record EnhancementResult(String text, boolean inserted) {

    public static EnhancementResult rejected(String text) {
        return new EnhancementResult(text, false);
    }

    public static EnhancementResult inserted(String text) {
        return new EnhancementResult(text, true);
    }
}
