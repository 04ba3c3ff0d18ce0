package com.resumetailor.domain.optimization.model;

/**
 * Semantic region of a resume. Recomputed from paragraph text on every run, never persisted.
 */
public enum SectionType {
    SUMMARY("summary"),
    SKILLS("skills"),
    EXPERIENCE("experience"),
    PROJECTS("projects"),
    EDUCATION("education"),
    AWARDS("awards"),
    CERTIFICATIONS("certifications"),
    OTHER("other");

    private final String label;

    SectionType(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }
}
