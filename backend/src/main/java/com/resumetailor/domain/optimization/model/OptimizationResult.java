package com.resumetailor.domain.optimization.model;

import java.util.List;

/**
 * Final output of the optimization engine.
 *
 * @param document      the rebuilt document, same paragraph count as the input
 * @param keywordsAdded number of keyword insertions performed
 * @param changes       human-readable change log, in insertion order
 */
public record OptimizationResult(
        ResumeDocument document,
        int keywordsAdded,
        List<String> changes
) {
    public OptimizationResult {
        changes = changes != null ? List.copyOf(changes) : List.of();
    }

    public static OptimizationResult unchanged(ResumeDocument document) {
        return new OptimizationResult(document, 0, List.of());
    }
}
