package com.resumetailor.infrastructure.optimization.keyword;

import com.resumetailor.infrastructure.optimization.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Case-insensitive, whole-word keyword lookup on normalized text, so that "CI/CD" in a
 * paragraph matches the extracted keyword "CICD" and "Java" does not match "JavaScript".
 */
@Component
@RequiredArgsConstructor
public class KeywordMatcher {

    static final int PATTERN_CACHE_SIZE = 512;

    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}+#.\\-]*");

    private final TextNormalizer textNormalizer;

    // Keys come from job descriptions, so the cache must not grow with traffic
    private final Map<String, Pattern> patternCache = Collections.synchronizedMap(
            new LinkedHashMap<>(64, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Pattern> eldest) {
                    return size() > PATTERN_CACHE_SIZE;
                }
            });

    public boolean contains(String text, String keyword) {
        return countOccurrences(text, keyword) > 0;
    }

    public int countOccurrences(String text, String keyword) {
        if (text == null || text.isBlank() || keyword == null || keyword.isBlank()) {
            return 0;
        }
        String key = textNormalizer.normalize(keyword).toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return 0;
        }
        String normalized = textNormalizer.normalize(text).toLowerCase(Locale.ROOT);
        Matcher m = patternFor(key).matcher(normalized);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    /**
     * Number of words in the text (identifier-like tokens; separators such as "|" are not words).
     */
    public int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        Matcher m = WORD.matcher(textNormalizer.normalize(text));
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }

    int patternCacheSize() {
        return patternCache.size();
    }

    private Pattern patternFor(String key) {
        return patternCache.computeIfAbsent(key, k -> {
            String body = Arrays.stream(k.split(" "))
                    .map(Pattern::quote)
                    .collect(Collectors.joining("\\s+"));
            // Trailing "." belongs to the sentence, not the word
            return Pattern.compile("(?<![\\p{L}\\p{N}+#.\\-])" + body + "(?![\\p{L}\\p{N}+#]|[.\\-][\\p{L}\\p{N}])");
        });
    }
}
