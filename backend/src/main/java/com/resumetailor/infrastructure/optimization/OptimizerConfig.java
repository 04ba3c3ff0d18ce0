package com.resumetailor.infrastructure.optimization;

import com.resumetailor.domain.optimization.model.SectionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Slf4j
@Configuration
public class OptimizerConfig {

    @Value("${optimizer.max-keywords-added:15}")
    private int maxKeywordsAdded;

    @Value("${optimizer.density-limit:0.03}")
    private double densityLimit;

    @Value("${optimizer.min-job-description-length:50}")
    private int minJobDescriptionLength;

    @Value("${optimizer.job-description-top-k:50}")
    private int jobDescriptionTopK;

    @Value("${optimizer.resume-top-k:30}")
    private int resumeTopK;

    @Value("${optimizer.max-missing-keywords:30}")
    private int maxMissingKeywords;

    @Value("${optimizer.prediction-timeout-ms:2000}")
    private long predictionTimeoutMs;

    @Value("${optimizer.section-budget.summary:3}")
    private int summaryBudget;

    @Value("${optimizer.section-budget.skills:8}")
    private int skillsBudget;

    @Value("${optimizer.section-budget.experience:5}")
    private int experienceBudget;

    @Value("${optimizer.section-budget.projects:4}")
    private int projectsBudget;

    @Value("${optimizer.section-budget.education:0}")
    private int educationBudget;

    @Value("${optimizer.section-budget.awards:0}")
    private int awardsBudget;

    @Value("${optimizer.section-budget.certifications:0}")
    private int certificationsBudget;

    @Value("${optimizer.section-budget.other:2}")
    private int otherBudget;

    @Bean
    public OptimizerSettings optimizerSettings() {
        Map<SectionType, Integer> budgets = new EnumMap<>(SectionType.class);
        budgets.put(SectionType.SUMMARY, summaryBudget);
        budgets.put(SectionType.SKILLS, skillsBudget);
        budgets.put(SectionType.EXPERIENCE, experienceBudget);
        budgets.put(SectionType.PROJECTS, projectsBudget);
        budgets.put(SectionType.EDUCATION, educationBudget);
        budgets.put(SectionType.AWARDS, awardsBudget);
        budgets.put(SectionType.CERTIFICATIONS, certificationsBudget);
        budgets.put(SectionType.OTHER, otherBudget);

        OptimizerSettings settings = new OptimizerSettings(
                maxKeywordsAdded, densityLimit, minJobDescriptionLength,
                jobDescriptionTopK, resumeTopK, maxMissingKeywords,
                Duration.ofMillis(predictionTimeoutMs), budgets);

        log.info("Optimizer settings - maxKeywordsAdded: {}, densityLimit: {}, sectionBudgets: {}",
                settings.maxKeywordsAdded(), settings.densityLimit(), settings.sectionBudgets());
        return settings;
    }
}
