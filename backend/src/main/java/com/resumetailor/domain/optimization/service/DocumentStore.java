package com.resumetailor.domain.optimization.service;

import com.resumetailor.domain.optimization.model.ResumeDocument;

import java.nio.file.Path;

/**
 * Source and sink for stored resume files. The file format is opaque to the engine.
 */
public interface DocumentStore {

    /**
     * Read the ordered paragraph list with per-paragraph formatting.
     */
    ResumeDocument read(Path source);

    /**
     * Write the paragraphs, with their formatting, to a new file at {@code target}.
     */
    void write(ResumeDocument document, Path target);
}
