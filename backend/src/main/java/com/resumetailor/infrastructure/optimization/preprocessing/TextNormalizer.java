package com.resumetailor.infrastructure.optimization.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes resume and job-description text before analysis:
 * - Unicode NFC normalization
 * - Invisible character removal
 * - Whitelist filter (letters, digits, whitespace and the technical punctuation + # . -)
 * - Whitespace normalization (collapse runs, trim)
 *
 * {@code normalize(normalize(x)).equals(normalize(x))} holds for every input.
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Everything outside the whitelist
    private static final Pattern NON_WHITELISTED = Pattern.compile("[^\\p{L}\\p{N}\\s+#.\\-]");

    // Any whitespace run (including newlines and tabs)
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Normalize text for keyword analysis.
     *
     * @param text raw text
     * @return normalized text, empty for null input
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        // 1. Unicode NFC normalization
        String result = Normalizer.normalize(text, Normalizer.Form.NFC);

        // 2. Remove invisible characters
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");

        // 3. Drop characters outside the whitelist
        result = NON_WHITELISTED.matcher(result).replaceAll("");

        // 4. Collapse whitespace runs to a single space
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");

        // 5. Trim
        return result.strip();
    }
}
