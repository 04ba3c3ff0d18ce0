package com.resumetailor.infrastructure.optimization.pipeline;

import com.resumetailor.domain.optimization.model.Keyword;
import com.resumetailor.domain.optimization.model.OptimizationResult;
import com.resumetailor.domain.optimization.model.OptimizationRunState;
import com.resumetailor.domain.optimization.model.ResumeDocument;
import com.resumetailor.domain.optimization.service.DocumentStore;
import com.resumetailor.infrastructure.optimization.OptimizerSettings;
import com.resumetailor.infrastructure.optimization.ResumeInputException;
import com.resumetailor.infrastructure.optimization.keyword.GapAnalyzer;
import com.resumetailor.infrastructure.optimization.keyword.KeywordGap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Entry point of resume optimization.
 *
 * Pipeline:
 * 1. Validate inputs (fails fast, nothing extracted)
 * 2. Gap analysis: job-description keywords missing from the resume
 * 3. Rebuild the document with a fresh run state
 *
 * An empty job-description vocabulary or an empty gap returns the input unchanged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeOptimizationEngine {

    private final GapAnalyzer gapAnalyzer;
    private final DocumentRebuilder documentRebuilder;
    private final DocumentStore documentStore;
    private final OptimizerSettings settings;

    public OptimizationResult optimize(ResumeDocument resume, String jobDescription) {
        validate(resume, jobDescription);

        long startTime = System.currentTimeMillis();
        KeywordGap gap = gapAnalyzer.analyze(resume.fullText(), jobDescription);

        if (gap.isDegraded()) {
            log.warn("[Engine] No keywords could be extracted from the job description, returning resume unchanged");
            return OptimizationResult.unchanged(resume);
        }
        if (gap.candidates().isEmpty()) {
            log.info("[Engine] Resume already covers the job description vocabulary");
            return OptimizationResult.unchanged(resume);
        }

        OptimizationRunState runState = new OptimizationRunState();
        ResumeDocument rebuilt = documentRebuilder.rebuild(resume, gap, runState);

        log.info("[Engine] Optimization complete - paragraphs: {}, candidates: {}, added: {}, keywords: {}, {}ms",
                rebuilt.size(), gap.candidates().size(), runState.getKeywordsAddedCount(),
                runState.getProcessedKeywords(), System.currentTimeMillis() - startTime);

        return new OptimizationResult(rebuilt, runState.getKeywordsAddedCount(), runState.getChanges());
    }

    /**
     * Read {@code source}, optimize, and write the result to {@code target}. The source file is
     * never modified.
     */
    public OptimizationResult optimizeFile(Path source, String jobDescription, Path target) {
        validateJobDescription(jobDescription);
        if (source.toAbsolutePath().normalize().equals(target.toAbsolutePath().normalize())) {
            throw new ResumeInputException("Target path must differ from the source resume: " + source);
        }

        ResumeDocument resume = documentStore.read(source);
        OptimizationResult result = optimize(resume, jobDescription);
        documentStore.write(result.document(), target);

        log.info("[Engine] Wrote optimized resume to {} ({} keywords added)", target, result.keywordsAdded());
        return result;
    }

    /**
     * Missing keywords between a resume text and a job description, without rewriting anything.
     */
    public List<Keyword> missingKeywords(String resumeText, String jobDescription) {
        validateJobDescription(jobDescription);
        return gapAnalyzer.missingKeywords(resumeText, jobDescription, Set.of(), settings.maxMissingKeywords());
    }

    private void validate(ResumeDocument resume, String jobDescription) {
        validateJobDescription(jobDescription);
        if (resume == null || resume.fullText().isBlank()) {
            throw new ResumeInputException("Resume contains no text");
        }
    }

    private void validateJobDescription(String jobDescription) {
        // Raw length: punctuation such as "CI/CD, AWS" counts
        int length = jobDescription == null ? 0 : jobDescription.strip().length();
        if (length < settings.minJobDescriptionLength()) {
            throw new ResumeInputException(String.format(
                    "Job description is too short: %d characters, at least %d required",
                    length, settings.minJobDescriptionLength()));
        }
    }
}
