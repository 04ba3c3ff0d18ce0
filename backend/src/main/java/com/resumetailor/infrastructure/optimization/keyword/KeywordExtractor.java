package com.resumetailor.infrastructure.optimization.keyword;

import com.resumetailor.domain.optimization.model.Keyword;
import com.resumetailor.infrastructure.optimization.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frequency-ranked 1-3 gram extraction.
 *
 * Text is split at clause boundaries (commas, semicolons, bullets, sentence ends...)
 * before normalization so that n-grams never span a list separator. Every n-gram
 * containing a stop word is dropped. Terms are scored by raw occurrence count;
 * ties keep first-occurrence order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KeywordExtractor {

    private static final int MIN_TEXT_LENGTH = 10;
    private static final int MAX_NGRAM = 3;

    private static final Pattern CLAUSE_BOUNDARY = Pattern.compile(
            "[,;:|!?()\\[\\]{}<>\"\\n\\r\\u2022\\u00B7\\u2013\\u2014]+|\\.(?=\\s|$)"
    );

    // Identifier-like token: starts with a letter/digit, may carry + # . - inside
    private static final Pattern TOKEN = Pattern.compile(
            "[\\p{L}\\p{N}](?:[\\p{L}\\p{N}+#.\\-]*[\\p{L}\\p{N}+#])?"
    );

    private static final Pattern VALID_TERM = Pattern.compile("[\\p{L}\\p{N}][\\p{L}\\p{N}+#.\\- ]*");

    private static final Pattern PURELY_NUMERIC = Pattern.compile("[\\d.,+#\\- ]+");

    private static final Pattern URL_FRAGMENT = Pattern.compile(
            "^(?:https?|www)|\\.(?:com|org|io|dev|edu|gov|co)(?:\\W|$)",
            Pattern.CASE_INSENSITIVE
    );

    private final TextNormalizer textNormalizer;

    private static final class Candidate {
        private final String display;
        private int count;

        private Candidate(String display) {
            this.display = display;
        }
    }

    /**
     * Extract the {@code topK} most frequent terms.
     *
     * @param text raw text
     * @param topK maximum number of keywords to return
     * @return keywords, highest frequency first; empty for empty or near-empty input
     */
    public List<Keyword> extract(String text, int topK) {
        if (text == null || text.strip().length() < MIN_TEXT_LENGTH || topK <= 0) {
            return List.of();
        }

        // Insertion order of the map is first-occurrence order
        Map<String, Candidate> candidates = new LinkedHashMap<>();

        for (String clause : CLAUSE_BOUNDARY.split(text)) {
            String normalized = textNormalizer.normalize(clause);
            if (normalized.isEmpty()) {
                continue;
            }
            List<String> tokens = tokenize(normalized);
            for (int i = 0; i < tokens.size(); i++) {
                for (int n = 1; n <= MAX_NGRAM && i + n <= tokens.size(); n++) {
                    String last = tokens.get(i + n - 1);
                    // Longer grams from this start would contain the same token
                    if (StopWords.isStopWord(last) || isUrlFragment(last)) {
                        break;
                    }
                    String term = String.join(" ", tokens.subList(i, i + n));
                    if (!isValidTerm(term)) {
                        continue;
                    }
                    candidates.computeIfAbsent(term.toLowerCase(Locale.ROOT), k -> new Candidate(term)).count++;
                }
            }
        }

        // List.sort is stable: equal counts keep first-occurrence order
        List<Candidate> ranked = new ArrayList<>(candidates.values());
        ranked.sort(Comparator.comparingInt((Candidate c) -> c.count).reversed());

        List<Keyword> keywords = ranked.stream()
                .limit(topK)
                .map(c -> new Keyword(c.display, c.count))
                .toList();

        log.debug("Extracted {} keywords (of {} candidates)", keywords.size(), candidates.size());
        return keywords;
    }

    /**
     * Validity predicate: length >= 2, not purely numeric, not a URL fragment,
     * identifier-like with technical punctuation.
     */
    boolean isValidTerm(String term) {
        if (term == null || term.length() < 2) {
            return false;
        }
        if (PURELY_NUMERIC.matcher(term).matches()) {
            return false;
        }
        if (isUrlFragment(term)) {
            return false;
        }
        return VALID_TERM.matcher(term).matches();
    }

    private boolean isUrlFragment(String token) {
        return URL_FRAGMENT.matcher(token).find();
    }

    private List<String> tokenize(String normalized) {
        List<String> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(normalized);
        while (m.find()) {
            tokens.add(m.group());
        }
        return tokens;
    }
}
