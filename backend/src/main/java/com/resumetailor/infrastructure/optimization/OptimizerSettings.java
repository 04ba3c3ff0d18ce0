package com.resumetailor.infrastructure.optimization;

import com.resumetailor.domain.optimization.model.SectionType;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Tunable limits of the optimization engine.
 *
 * @param maxKeywordsAdded        global insertion ceiling per run
 * @param densityLimit            maximum keyword occurrences / word count in an edited paragraph
 * @param minJobDescriptionLength shortest accepted job description, in normalized characters
 * @param jobDescriptionTopK      keywords extracted from the job description
 * @param resumeTopK              keywords extracted from the resume
 * @param maxMissingKeywords      cap on the missing-keyword list handed to the rebuilder
 * @param predictionTimeout       wait limit for one prediction-service call
 * @param sectionBudgets          per-section insertion ceiling
 */
public record OptimizerSettings(
        int maxKeywordsAdded,
        double densityLimit,
        int minJobDescriptionLength,
        int jobDescriptionTopK,
        int resumeTopK,
        int maxMissingKeywords,
        Duration predictionTimeout,
        Map<SectionType, Integer> sectionBudgets
) {

    public OptimizerSettings {
        EnumMap<SectionType, Integer> budgets = new EnumMap<>(SectionType.class);
        if (sectionBudgets != null) {
            budgets.putAll(sectionBudgets);
        }
        sectionBudgets = Collections.unmodifiableMap(budgets);
    }

    public static OptimizerSettings defaults() {
        return new OptimizerSettings(15, 0.03, 50, 50, 30, 30, Duration.ofSeconds(2), defaultBudgets());
    }

    public static Map<SectionType, Integer> defaultBudgets() {
        Map<SectionType, Integer> budgets = new EnumMap<>(SectionType.class);
        budgets.put(SectionType.SUMMARY, 3);
        budgets.put(SectionType.SKILLS, 8);
        budgets.put(SectionType.EXPERIENCE, 5);
        budgets.put(SectionType.PROJECTS, 4);
        budgets.put(SectionType.EDUCATION, 0);
        budgets.put(SectionType.AWARDS, 0);
        budgets.put(SectionType.CERTIFICATIONS, 0);
        budgets.put(SectionType.OTHER, 2);
        return budgets;
    }

    public int budgetFor(SectionType section) {
        return sectionBudgets.getOrDefault(section, 0);
    }

    public OptimizerSettings withMaxKeywordsAdded(int max) {
        return new OptimizerSettings(max, densityLimit, minJobDescriptionLength, jobDescriptionTopK,
                resumeTopK, maxMissingKeywords, predictionTimeout, sectionBudgets);
    }

    public OptimizerSettings withDensityLimit(double limit) {
        return new OptimizerSettings(maxKeywordsAdded, limit, minJobDescriptionLength, jobDescriptionTopK,
                resumeTopK, maxMissingKeywords, predictionTimeout, sectionBudgets);
    }

    public OptimizerSettings withSectionBudget(SectionType section, int budget) {
        Map<SectionType, Integer> budgets = new EnumMap<>(SectionType.class);
        budgets.putAll(sectionBudgets);
        budgets.put(section, budget);
        return new OptimizerSettings(maxKeywordsAdded, densityLimit, minJobDescriptionLength, jobDescriptionTopK,
                resumeTopK, maxMissingKeywords, predictionTimeout, budgets);
    }
}
