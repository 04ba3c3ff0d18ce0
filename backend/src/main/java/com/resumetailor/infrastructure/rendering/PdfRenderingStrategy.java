package com.resumetailor.infrastructure.rendering;

import com.resumetailor.domain.optimization.model.ResumeDocument;

import java.nio.file.Path;

/**
 * One way of turning a rebuilt resume into a PDF.
 */
public interface PdfRenderingStrategy {

    String name();

    /**
     * Whether this strategy can run in the current environment at all.
     */
    boolean isAvailable();

    /**
     * @param docx     the rebuilt .docx on disk
     * @param document the same content in memory
     * @param target   where the PDF must end up
     * @throws PdfRenderingException if no PDF was produced
     */
    void render(Path docx, ResumeDocument document, Path target);
}
