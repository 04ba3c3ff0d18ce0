package com.resumetailor.application.resume;

import com.resumetailor.domain.resume.model.Resume;

import java.util.List;

public record OptimizationOutcome(
        Resume resume,
        int keywordsAdded,
        List<String> changes
) {}
