package com.resumetailor.infrastructure.optimization.enhancement;

import com.resumetailor.domain.optimization.model.EnhancementResult;
import com.resumetailor.domain.optimization.model.Keyword;
import com.resumetailor.domain.optimization.model.OptimizationRunState;
import com.resumetailor.domain.optimization.model.SectionType;
import com.resumetailor.domain.optimization.service.TokenPredictionService;
import com.resumetailor.infrastructure.optimization.OptimizerSettings;
import com.resumetailor.infrastructure.optimization.keyword.KeywordMatcher;
import com.resumetailor.infrastructure.optimization.keyword.StopWords;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Inserts one keyword into one paragraph.
 *
 * Skill lists get the keyword appended as another list item. Everything else gets a
 * section template sentence appended; its lead word may be replaced by the prediction
 * service, and any failure of that service falls back to the template wording.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContextualEnhancer {

    private static final List<String> LIST_DELIMITERS = List.of("|", "•", ";", ",");
    private static final int MAX_LIST_ITEM_WORDS = 4;
    private static final Pattern ACCEPTED_PREDICTION = Pattern.compile("[A-Za-z]{3,}");
    private static final Pattern SENTENCE_TERMINATOR = Pattern.compile("[.!?]$");

    private final DensityGuard densityGuard;
    private final KeywordMatcher keywordMatcher;
    private final EnhancementTemplateRegistry templateRegistry;
    private final TokenPredictionService tokenPredictionService;
    private final OptimizerSettings settings;

    public EnhancementResult enhance(String paragraphText, Keyword keyword, SectionType section,
                                     OptimizationRunState runState) {
        if (paragraphText == null || paragraphText.isBlank()) {
            return EnhancementResult.rejected(paragraphText);
        }
        if (keywordMatcher.contains(paragraphText, keyword.text())) {
            return EnhancementResult.rejected(paragraphText);
        }
        if (!densityGuard.allowsInsertion(paragraphText, keyword, settings.densityLimit())) {
            log.debug("[ContextualEnhancer] density limit blocks '{}' in {}", keyword.text(), section.getLabel());
            return EnhancementResult.rejected(paragraphText);
        }

        String enhanced = section == SectionType.SKILLS
                ? appendToSkillList(paragraphText, keyword.text())
                : null;
        if (enhanced == null) {
            enhanced = appendSentence(paragraphText, keyword.text(), section);
        }
        if (enhanced == null) {
            return EnhancementResult.rejected(paragraphText);
        }

        runState.markInserted(keyword.text(), section);
        log.debug("[ContextualEnhancer] inserted '{}' into {}", keyword.text(), section.getLabel());
        return EnhancementResult.inserted(enhanced);
    }

    /**
     * Append as one more item of a delimiter-separated list, or null if the paragraph is prose.
     */
    String appendToSkillList(String text, String keyword) {
        String body = text.strip();
        boolean period = body.endsWith(".");
        if (period) {
            body = body.substring(0, body.length() - 1).stripTrailing();
        }

        for (String delimiter : LIST_DELIMITERS) {
            if (!body.contains(delimiter)) {
                continue;
            }
            String[] items = body.split(Pattern.quote(delimiter));
            if (items.length < 2 || !allShortItems(items)) {
                return null;
            }
            String separator = separatorFor(body, delimiter);
            return body + separator + keyword + (period ? "." : "");
        }
        return null;
    }

    private String appendSentence(String text, String keyword, SectionType section) {
        int wordCount = keywordMatcher.wordCount(text);
        EnhancementTemplate template = templateRegistry.select(section, wordCount);
        if (template == null) {
            return null;
        }

        String sentence = predictLeadWord(text, template, keyword)
                .map(lead -> template.render(lead, keyword))
                .orElseGet(() -> template.render(keyword));

        String base = text.strip();
        if (!SENTENCE_TERMINATOR.matcher(base).find()) {
            base = base + ".";
        }
        return base + " " + sentence;
    }

    private Optional<String> predictLeadWord(String text, EnhancementTemplate template, String keyword) {
        String context = text.strip() + " " + template.masked(keyword);
        CompletableFuture<List<String>> future = CompletableFuture.supplyAsync(() ->
                tokenPredictionService.predict(context));
        try {
            List<String> candidates = future.get(settings.predictionTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (candidates == null) {
                return Optional.empty();
            }
            return candidates.stream()
                    .map(String::strip)
                    .filter(c -> ACCEPTED_PREDICTION.matcher(c).matches())
                    .filter(c -> !StopWords.isStopWord(c))
                    .findFirst()
                    .map(ContextualEnhancer::capitalize);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[ContextualEnhancer] prediction timed out after {}ms, using template {}",
                    settings.predictionTimeout().toMillis(), template.id());
        } catch (ExecutionException e) {
            log.warn("[ContextualEnhancer] prediction failed, using template {}: {}",
                    template.id(), e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ContextualEnhancer] prediction interrupted, using template {}", template.id());
        }
        return Optional.empty();
    }

    private static boolean allShortItems(String[] items) {
        for (String item : items) {
            String trimmed = item.strip();
            if (trimmed.isEmpty() || trimmed.split("\\s+").length > MAX_LIST_ITEM_WORDS) {
                return false;
            }
        }
        return true;
    }

    private static String separatorFor(String body, String delimiter) {
        if (delimiter.equals(",") || delimiter.equals(";")) {
            return delimiter + " ";
        }
        return body.contains(" " + delimiter + " ") ? " " + delimiter + " " : delimiter;
    }

    private static String capitalize(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
