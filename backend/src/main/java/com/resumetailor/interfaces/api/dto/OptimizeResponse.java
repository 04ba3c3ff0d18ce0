package com.resumetailor.interfaces.api.dto;

import java.util.List;
import java.util.UUID;

public record OptimizeResponse(
        UUID resumeId,
        String status,
        int keywordsAdded,
        List<String> changes,
        boolean pdfAvailable
) {}
