package com.resumetailor.infrastructure.optimization.enhancement;

import com.resumetailor.domain.optimization.model.SectionType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.resumetailor.domain.optimization.model.SectionType.*;

/**
 * Per-section phrase templates, shortest first. Sections without templates never receive
 * sentence insertions.
 */
@Component
public class EnhancementTemplateRegistry {

    private final Map<SectionType, List<EnhancementTemplate>> templates = new EnumMap<>(SectionType.class);

    public EnhancementTemplateRegistry() {
        register(SKILLS, new EnhancementTemplate("SKL_PROFICIENT", "Proficient", "in {kw}."));
        register(SKILLS, new EnhancementTemplate("SKL_APPLYING", "Skilled", "in applying {kw}."));
        register(SKILLS, new EnhancementTemplate("SKL_PROJECTS", "Experienced", "with {kw} across multiple projects."));

        register(EXPERIENCE, new EnhancementTemplate("EXP_UTILIZED", "Utilized", "{kw} for development."));
        register(EXPERIENCE, new EnhancementTemplate("EXP_APPLIED", "Applied", "{kw} to improve delivery."));
        register(EXPERIENCE, new EnhancementTemplate("EXP_LEVERAGED", "Leveraged", "{kw} to build and maintain production systems."));

        register(PROJECTS, new EnhancementTemplate("PRJ_BUILT", "Built", "with {kw}."));
        register(PROJECTS, new EnhancementTemplate("PRJ_IMPLEMENTED", "Implemented", "features using {kw}."));
        register(PROJECTS, new EnhancementTemplate("PRJ_INTEGRATED", "Integrated", "{kw} into the project architecture."));

        register(SUMMARY, new EnhancementTemplate("SUM_SKILLED", "Skilled", "in {kw}."));
        register(SUMMARY, new EnhancementTemplate("SUM_EXPERIENCED", "Experienced", "with {kw}."));
        register(SUMMARY, new EnhancementTemplate("SUM_EXPERTISE", "Brings", "practical expertise in {kw}."));

        register(OTHER, new EnhancementTemplate("OTH_FAMILIAR", "Familiar", "with {kw}."));
        register(OTHER, new EnhancementTemplate("OTH_KNOWLEDGE", "Working", "knowledge of {kw}."));
    }

    private void register(SectionType section, EnhancementTemplate template) {
        templates.computeIfAbsent(section, s -> new ArrayList<>()).add(template);
    }

    public List<EnhancementTemplate> templatesFor(SectionType section) {
        return Collections.unmodifiableList(templates.getOrDefault(section, List.of()));
    }

    /**
     * Deterministic choice: longer paragraphs get longer templates,
     * index = min(count - 1, wordCount / 20).
     */
    public EnhancementTemplate select(SectionType section, int paragraphWordCount) {
        List<EnhancementTemplate> candidates = templatesFor(section);
        if (candidates.isEmpty()) {
            return null;
        }
        int index = Math.min(candidates.size() - 1, paragraphWordCount / 20);
        return candidates.get(index);
    }
}
