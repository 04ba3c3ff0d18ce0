package com.resumetailor.interfaces.api.dto;

import java.util.UUID;

public record UploadResponse(
        UUID resumeId,
        String originalFilename,
        String status
) {}
