package com.resumetailor.application.resume;

import java.util.Locale;

public enum DownloadFormat {
    PDF("application/pdf"),
    DOCX("application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    private final String contentType;

    DownloadFormat(String contentType) {
        this.contentType = contentType;
    }

    public String getContentType() {
        return contentType;
    }

    public String getExtension() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DownloadFormat from(String value) {
        if (value == null || value.isBlank()) {
            return PDF;
        }
        try {
            return valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported download format: " + value + " (pdf or docx)");
        }
    }
}
