package com.resumetailor.domain.optimization.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Bookkeeping for one optimization run. Created fresh per document and never shared
 * between runs, so parallel runs cannot observe each other's dedup sets.
 */
@Getter
public class OptimizationRunState {

    private final Set<String> processedKeywords = new LinkedHashSet<>();
    private final List<String> changes = new ArrayList<>();
    private int keywordsAddedCount;
    private int sectionKeywordsUsed;
    private SectionType currentSection;

    public boolean isProcessed(String keyword) {
        return processedKeywords.contains(keyword.toLowerCase(Locale.ROOT));
    }

    /**
     * Record a successful insertion of {@code keyword} into a paragraph of {@code section}.
     */
    public void markInserted(String keyword, SectionType section) {
        processedKeywords.add(keyword.toLowerCase(Locale.ROOT));
        keywordsAddedCount++;
        changes.add(String.format("Added '%s' to %s.", keyword, section.getLabel()));
    }

    /**
     * A header paragraph switches the current section and resets its insertion counter.
     */
    public void enterSection(SectionType section) {
        this.currentSection = section;
        this.sectionKeywordsUsed = 0;
    }

    public void recordSectionInsertion() {
        sectionKeywordsUsed++;
    }

    public Set<String> getProcessedKeywords() {
        return Collections.unmodifiableSet(processedKeywords);
    }

    public List<String> getChanges() {
        return Collections.unmodifiableList(changes);
    }
}
