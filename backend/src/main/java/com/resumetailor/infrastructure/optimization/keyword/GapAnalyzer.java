package com.resumetailor.infrastructure.optimization.keyword;

import com.resumetailor.domain.optimization.model.Keyword;
import com.resumetailor.infrastructure.optimization.OptimizerSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the ordered list of job-description keywords missing from a resume.
 *
 * A job-description keyword is missing when:
 * - its case-insensitive form is not among the resume keywords and does not occur anywhere
 *   in the resume text
 * - it is longer than 2 characters
 * - it is relevant: technical (curated term, digit/version, acronym) or, as a fallback,
 *   longer than 3 characters
 * - it does not overlap a higher-ranked candidate (one contains the other as whole words)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GapAnalyzer {

    private static final int MIN_KEYWORD_LENGTH = 3;
    private static final int FALLBACK_MIN_LENGTH = 4;

    private final KeywordExtractor keywordExtractor;
    private final KeywordMatcher keywordMatcher;
    private final OptimizerSettings settings;

    /**
     * Extract both vocabularies and compute the candidate list.
     */
    public KeywordGap analyze(String resumeText, String jobDescriptionText) {
        List<Keyword> jdKeywords = keywordExtractor.extract(jobDescriptionText, settings.jobDescriptionTopK());
        List<Keyword> resumeKeywords = keywordExtractor.extract(resumeText, settings.resumeTopK());

        Set<String> resumeKeys = resumeKeywords.stream()
                .map(Keyword::key)
                .collect(Collectors.toSet());

        List<Keyword> candidates = new ArrayList<>();
        for (Keyword keyword : jdKeywords) {
            if (resumeKeys.contains(keyword.key())
                    || keyword.text().length() < MIN_KEYWORD_LENGTH
                    || !isRelevant(keyword)
                    || keywordMatcher.contains(resumeText, keyword.text())
                    || overlapsAny(keyword, candidates)) {
                continue;
            }
            candidates.add(keyword);
        }

        log.info("[GapAnalyzer] jdKeywords: {}, resumeKeywords: {}, missing: {}",
                jdKeywords.size(), resumeKeywords.size(),
                candidates.stream().map(Keyword::text).toList());

        return new KeywordGap(jdKeywords, resumeKeywords, candidates);
    }

    /**
     * Missing keywords not yet processed in the current run, in job-description frequency order.
     */
    public List<Keyword> missingKeywords(String resumeText,
                                         String jobDescriptionText,
                                         Collection<String> alreadyProcessed,
                                         int maxKeywords) {
        return analyze(resumeText, jobDescriptionText).remaining(alreadyProcessed, maxKeywords);
    }

    // "Docker" and "Docker Compose" would otherwise both be inserted
    private boolean overlapsAny(Keyword keyword, List<Keyword> accepted) {
        for (Keyword other : accepted) {
            if (keywordMatcher.contains(other.text(), keyword.text())
                    || keywordMatcher.contains(keyword.text(), other.text())) {
                return true;
            }
        }
        return false;
    }

    boolean isRelevant(Keyword keyword) {
        // Fallback keeps soft-skill dominated postings from yielding nothing
        return keyword.isTechnical() || keyword.text().length() >= FALLBACK_MIN_LENGTH;
    }
}
