package com.resumetailor.infrastructure.optimization.enhancement;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Drops later sentences that repeat an earlier one, ignoring case and punctuation.
 */
@Component
public class SentenceDeduplicator {

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}+#]+");

    public String deduplicate(String text) {
        if (text == null || text.isBlank()) {
            return text;
        }
        String[] sentences = SENTENCE_END.split(text.strip());
        if (sentences.length < 2) {
            return text;
        }

        Set<String> seen = new HashSet<>();
        List<String> kept = new ArrayList<>();
        for (String sentence : sentences) {
            String key = NON_ALNUM.matcher(sentence.toLowerCase(Locale.ROOT)).replaceAll("");
            if (key.isEmpty() || seen.add(key)) {
                kept.add(sentence);
            }
        }
        if (kept.size() == sentences.length) {
            return text;
        }
        return String.join(" ", kept);
    }
}
