package com.resumetailor.infrastructure.optimization.enhancement;

import com.resumetailor.domain.optimization.model.Keyword;
import com.resumetailor.infrastructure.optimization.keyword.KeywordMatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Bounds how often a keyword may appear in the paragraph being edited.
 *
 * Must be consulted before every insertion attempt since the paragraph grows as
 * keywords are added.
 */
@Component
@RequiredArgsConstructor
public class DensityGuard {

    static final int MIN_MEASURABLE_WORDS = 10;

    private final KeywordMatcher keywordMatcher;

    /**
     * @return true if one more occurrence of {@code keyword} keeps its share of the block's
     * words strictly under {@code limit}; always true for blocks under ten words
     */
    public boolean allowsInsertion(String textBlock, Keyword keyword, double limit) {
        int words = keywordMatcher.wordCount(textBlock);
        if (words < MIN_MEASURABLE_WORDS) {
            return true;
        }
        int occurrencesAfter = keywordMatcher.countOccurrences(textBlock, keyword.text()) + 1;
        int wordsAfter = words + keyword.wordCount();
        return (double) occurrencesAfter / wordsAfter < limit;
    }

    public double density(String textBlock, String keyword) {
        int words = keywordMatcher.wordCount(textBlock);
        if (words == 0) {
            return 0;
        }
        return (double) keywordMatcher.countOccurrences(textBlock, keyword) / words;
    }
}
