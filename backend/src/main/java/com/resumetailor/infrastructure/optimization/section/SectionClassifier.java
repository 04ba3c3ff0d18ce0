package com.resumetailor.infrastructure.optimization.section;

import com.resumetailor.domain.optimization.model.SectionType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.resumetailor.domain.optimization.model.SectionType.*;

/**
 * Maps paragraph text to a resume section.
 *
 * Header detection and content fallback are both driven by the tables below; the
 * running "current section" belongs to the caller.
 */
@Component
public class SectionClassifier {

    private static final int MAX_HEADER_WORDS = 5;

    private static final Map<SectionType, List<String>> HEADER_KEYWORDS = new EnumMap<>(SectionType.class);

    static {
        HEADER_KEYWORDS.put(SUMMARY, List.of(
                "summary", "professional summary", "career summary", "profile", "professional profile",
                "objective", "career objective", "about me", "overview"));
        HEADER_KEYWORDS.put(SKILLS, List.of(
                "skills", "technical skills", "key skills", "core skills", "competencies",
                "core competencies", "technologies", "tech stack", "tools and technologies", "expertise"));
        HEADER_KEYWORDS.put(EXPERIENCE, List.of(
                "experience", "work experience", "professional experience", "employment",
                "employment history", "work history", "career history"));
        HEADER_KEYWORDS.put(PROJECTS, List.of(
                "projects", "personal projects", "key projects", "selected projects",
                "academic projects", "side projects"));
        HEADER_KEYWORDS.put(EDUCATION, List.of(
                "education", "academic background", "academic qualifications", "qualifications"));
        HEADER_KEYWORDS.put(AWARDS, List.of(
                "awards", "honors", "honours", "achievements", "awards and honors"));
        HEADER_KEYWORDS.put(CERTIFICATIONS, List.of(
                "certifications", "certification", "certificates", "licenses", "licenses and certifications"));
        HEADER_KEYWORDS.put(OTHER, List.of(
                "interests", "hobbies", "languages", "volunteering", "volunteer experience",
                "publications", "references", "activities"));
    }

    // Checked in order after header keywords fail
    private static final Map<SectionType, List<String>> CONTENT_HINTS = new LinkedHashMap<>();

    static {
        CONTENT_HINTS.put(PROJECTS, List.of("developed", "built", "implemented", "created", "designed"));
        CONTENT_HINTS.put(EXPERIENCE, List.of("managed", "led", "supervised", "coordinated", "mentored"));
        CONTENT_HINTS.put(EDUCATION, List.of("degree", "university", "college", "bachelor", "master", "gpa"));
    }

    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s:.\\-\\u2013\\u2014]+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public boolean isHeader(String text) {
        return headerSection(text).isPresent();
    }

    /**
     * Section announced by a header paragraph, or empty if the text is not a header.
     *
     * A header has at most five words and equals, or starts at a word boundary with, a header
     * keyword. An inline label followed by content ("Skills: Java, Git") is not a header.
     */
    public Optional<SectionType> headerSection(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String candidate = TRAILING_PUNCTUATION.matcher(text.strip().toLowerCase(Locale.ROOT)).replaceAll("");
        candidate = WHITESPACE.matcher(candidate).replaceAll(" ");
        if (candidate.isEmpty() || candidate.contains(":")) {
            return Optional.empty();
        }
        if (candidate.split(" ").length > MAX_HEADER_WORDS) {
            return Optional.empty();
        }

        SectionType best = null;
        int bestLength = 0;
        for (Map.Entry<SectionType, List<String>> entry : HEADER_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (keyword.length() > bestLength && startsWithWord(candidate, keyword)) {
                    best = entry.getKey();
                    bestLength = keyword.length();
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Classify any paragraph: header section if it is a header, otherwise header keyword
     * containment, then content hints, then {@link SectionType#OTHER}.
     */
    public SectionType classify(String text) {
        if (text == null || text.isBlank()) {
            return OTHER;
        }
        Optional<SectionType> header = headerSection(text);
        if (header.isPresent()) {
            return header.get();
        }

        String lower = " " + WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ") + " ";

        SectionType best = null;
        int bestLength = 0;
        for (Map.Entry<SectionType, List<String>> entry : HEADER_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (keyword.length() > bestLength && containsWord(lower, keyword)) {
                    best = entry.getKey();
                    bestLength = keyword.length();
                }
            }
        }
        if (best != null) {
            return best;
        }

        for (Map.Entry<SectionType, List<String>> entry : CONTENT_HINTS.entrySet()) {
            for (String hint : entry.getValue()) {
                if (containsWord(lower, hint)) {
                    return entry.getKey();
                }
            }
        }
        return OTHER;
    }

    private static boolean startsWithWord(String text, String keyword) {
        if (!text.startsWith(keyword)) {
            return false;
        }
        return text.length() == keyword.length() || !Character.isLetterOrDigit(text.charAt(keyword.length()));
    }

    private static boolean containsWord(String paddedText, String word) {
        int from = 0;
        while (true) {
            int idx = paddedText.indexOf(word, from);
            if (idx < 0) {
                return false;
            }
            int end = idx + word.length();
            boolean leftOk = idx == 0 || !Character.isLetterOrDigit(paddedText.charAt(idx - 1));
            boolean rightOk = end >= paddedText.length() || !Character.isLetterOrDigit(paddedText.charAt(end));
            if (leftOk && rightOk) {
                return true;
            }
            from = idx + 1;
        }
    }
}
