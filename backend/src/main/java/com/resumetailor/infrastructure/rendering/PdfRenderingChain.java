package com.resumetailor.infrastructure.rendering;

import com.resumetailor.domain.optimization.model.ResumeDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Tries each rendering strategy in order; the first one that produces a PDF wins.
 * A chain where every strategy fails is not an error for the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfRenderingChain {

    private final List<PdfRenderingStrategy> strategies;

    public Optional<Path> render(Path docx, ResumeDocument document, Path target) {
        for (PdfRenderingStrategy strategy : strategies) {
            if (!strategy.isAvailable()) {
                log.debug("[Rendering] {} unavailable, skipping", strategy.name());
                continue;
            }
            try {
                strategy.render(docx, document, target);
                log.info("[Rendering] PDF produced by {}: {}", strategy.name(), target);
                return Optional.of(target);
            } catch (PdfRenderingException e) {
                log.warn("[Rendering] {} failed: {}", strategy.name(), e.getMessage());
            }
        }
        log.warn("[Rendering] No strategy could render {}", docx);
        return Optional.empty();
    }
}
