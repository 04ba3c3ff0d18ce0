package com.resumetailor.infrastructure.optimization.keyword;

import com.resumetailor.domain.optimization.model.Keyword;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Snapshot of one resume / job-description comparison.
 *
 * @param jobDescriptionKeywords keywords extracted from the job description, frequency order
 * @param resumeKeywords         keywords extracted from the resume
 * @param candidates             job-description keywords absent from the resume that pass the
 *                               relevance filter, in job-description frequency order
 */
public record KeywordGap(
        List<Keyword> jobDescriptionKeywords,
        List<Keyword> resumeKeywords,
        List<Keyword> candidates
) {
    public KeywordGap {
        jobDescriptionKeywords = List.copyOf(jobDescriptionKeywords);
        resumeKeywords = List.copyOf(resumeKeywords);
        candidates = List.copyOf(candidates);
    }

    /**
     * Nothing usable could be extracted from the job description.
     */
    public boolean isDegraded() {
        return jobDescriptionKeywords.isEmpty();
    }

    /**
     * Candidates not yet in {@code alreadyProcessed} (compared case-insensitively), truncated.
     */
    public List<Keyword> remaining(Collection<String> alreadyProcessed, int maxKeywords) {
        return candidates.stream()
                .filter(k -> alreadyProcessed.stream().noneMatch(p -> p.toLowerCase(Locale.ROOT).equals(k.key())))
                .limit(Math.max(0, maxKeywords))
                .toList();
    }
}
