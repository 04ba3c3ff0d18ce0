package com.resumetailor.infrastructure.optimization.pipeline;

import com.resumetailor.domain.optimization.model.EnhancementResult;
import com.resumetailor.domain.optimization.model.Keyword;
import com.resumetailor.domain.optimization.model.OptimizationRunState;
import com.resumetailor.domain.optimization.model.Paragraph;
import com.resumetailor.domain.optimization.model.ResumeDocument;
import com.resumetailor.domain.optimization.model.SectionType;
import com.resumetailor.infrastructure.optimization.OptimizerSettings;
import com.resumetailor.infrastructure.optimization.enhancement.ContextualEnhancer;
import com.resumetailor.infrastructure.optimization.enhancement.SentenceDeduplicator;
import com.resumetailor.infrastructure.optimization.keyword.KeywordGap;
import com.resumetailor.infrastructure.optimization.keyword.KeywordMatcher;
import com.resumetailor.infrastructure.optimization.section.SectionClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Single linear pass over the paragraphs of a resume.
 *
 * Empty paragraphs and headers are copied verbatim; a header switches the current section
 * and resets its budget. Content paragraphs receive keywords until the section budget or
 * the global ceiling is reached. Above the first header, a paragraph is edited only when its
 * content identifies a section other than {@link SectionType#OTHER}. Each output paragraph keeps the formatting of its source
 * paragraph, and the paragraph count never changes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentRebuilder {

    private final SectionClassifier sectionClassifier;
    private final ContextualEnhancer contextualEnhancer;
    private final SentenceDeduplicator sentenceDeduplicator;
    private final KeywordMatcher keywordMatcher;
    private final OptimizerSettings settings;

    public ResumeDocument rebuild(ResumeDocument source, KeywordGap gap, OptimizationRunState runState) {
        List<Paragraph> output = new ArrayList<>(source.size());

        for (Paragraph paragraph : source.paragraphs()) {
            if (paragraph.isBlank()) {
                output.add(paragraph);
                continue;
            }

            Optional<SectionType> header = sectionClassifier.headerSection(paragraph.text());
            if (header.isPresent()) {
                runState.enterSection(header.get());
                log.debug("[DocumentRebuilder] section header '{}' -> {}", paragraph.text().strip(), header.get().getLabel());
                output.add(paragraph);
                continue;
            }

            output.add(enhanceContent(paragraph, gap, runState));
        }

        return new ResumeDocument(output);
    }

    private Paragraph enhanceContent(Paragraph paragraph, KeywordGap gap, OptimizationRunState runState) {
        SectionType section = runState.getCurrentSection();
        if (section == null) {
            section = sectionClassifier.classify(paragraph.text());
            // Contact block above the first header
            if (section == SectionType.OTHER) {
                return paragraph;
            }
        }
        int budget = settings.budgetFor(section);
        if (budget <= 0) {
            return paragraph;
        }

        String text = paragraph.text();
        boolean modified = false;

        for (Keyword keyword : gap.remaining(runState.getProcessedKeywords(), settings.maxMissingKeywords())) {
            if (runState.getSectionKeywordsUsed() >= budget
                    || runState.getKeywordsAddedCount() >= settings.maxKeywordsAdded()) {
                break;
            }
            if (keywordMatcher.contains(text, keyword.text())) {
                continue;
            }
            EnhancementResult result = contextualEnhancer.enhance(text, keyword, section, runState);
            if (result.inserted()) {
                text = result.text();
                runState.recordSectionInsertion();
                modified = true;
            }
        }

        if (!modified) {
            return paragraph;
        }
        return paragraph.withText(sentenceDeduplicator.deduplicate(text));
    }
}
