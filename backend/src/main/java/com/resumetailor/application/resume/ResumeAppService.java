package com.resumetailor.application.resume;

import com.resumetailor.application.resume.exception.InvalidResumeFileException;
import com.resumetailor.application.resume.exception.OptimizedResumeUnavailableException;
import com.resumetailor.application.resume.exception.ResumeAccessDeniedException;
import com.resumetailor.application.resume.exception.ResumeNotFoundException;
import com.resumetailor.domain.optimization.model.OptimizationResult;
import com.resumetailor.domain.resume.model.OptimizationStatus;
import com.resumetailor.domain.resume.model.Resume;
import com.resumetailor.domain.resume.repository.ResumeRepository;
import com.resumetailor.infrastructure.optimization.pipeline.ResumeOptimizationEngine;
import com.resumetailor.infrastructure.rendering.PdfRenderingChain;
import com.resumetailor.infrastructure.storage.ResumeFileStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Resume lifecycle: upload, optimize, status, download.
 *
 * Status transitions are saved one by one (no surrounding transaction) so that a FAILED
 * record survives the exception that caused it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeAppService {

    private static final String DOCX_EXTENSION = ".docx";

    private final ResumeRepository resumeRepository;
    private final ResumeFileStorage storage;
    private final ResumeOptimizationEngine optimizationEngine;
    private final PdfRenderingChain renderingChain;

    public Resume upload(String userId, MultipartFile file) {
        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(DOCX_EXTENSION)) {
            throw new InvalidResumeFileException("Only .docx resumes are supported.");
        }
        if (file.isEmpty()) {
            throw new InvalidResumeFileException("Uploaded resume is empty.");
        }

        Resume resume = resumeRepository.save(Resume.builder()
                .userId(userId)
                .originalFilename(filename)
                .build());

        Path stored;
        try {
            stored = storage.storeUpload(resume.getId(), file.getInputStream());
        } catch (IOException e) {
            throw new InvalidResumeFileException("Uploaded resume could not be read: " + e.getMessage());
        }

        resume.markUploaded(stored.toString());
        resumeRepository.save(resume);
        log.info("Resume uploaded - id: {}, userId: {}, file: {}", resume.getId(), userId, filename);
        return resume;
    }

    public OptimizationOutcome optimize(UUID resumeId, String userId, String jobDescription) {
        Resume resume = getResume(resumeId, userId);
        if (resume.getOriginalPath() == null) {
            throw new InvalidResumeFileException("Resume has no uploaded file.");
        }
        if (resume.getOptimizationStatus() == OptimizationStatus.PROCESSING) {
            throw new IllegalStateException("Resume optimization is already in progress.");
        }

        resume.startOptimization(jobDescription);
        resumeRepository.save(resume);

        Path source = Paths.get(resume.getOriginalPath());
        Path docxTarget = storage.optimizedDocxPath(resumeId);
        try {
            OptimizationResult result = optimizationEngine.optimizeFile(source, jobDescription, docxTarget);
            Optional<Path> pdf = renderingChain.render(docxTarget, result.document(), storage.renderedPdfPath(resumeId));

            resume.completeOptimization(docxTarget.toString(), pdf.map(Path::toString).orElse(null),
                    result.keywordsAdded());
            resumeRepository.save(resume);

            log.info("Resume optimized - id: {}, keywordsAdded: {}, pdf: {}",
                    resumeId, result.keywordsAdded(), pdf.isPresent());
            return new OptimizationOutcome(resume, result.keywordsAdded(), result.changes());
        } catch (RuntimeException e) {
            log.warn("Resume optimization failed - id: {}, reason: {}", resumeId, e.getMessage());
            resume.failOptimization(e.getMessage());
            resumeRepository.save(resume);
            throw e;
        }
    }

    public Resume getResume(UUID resumeId, String userId) {
        Resume resume = resumeRepository.findById(resumeId)
                .orElseThrow(() -> new ResumeNotFoundException(resumeId));
        if (!resume.isOwnedBy(userId)) {
            throw new ResumeAccessDeniedException();
        }
        return resume;
    }

    public List<Resume> listResumes(String userId) {
        return resumeRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    public Path resolveDownload(UUID resumeId, String userId, DownloadFormat format) {
        Resume resume = getResume(resumeId, userId);
        if (resume.getOptimizationStatus() != OptimizationStatus.COMPLETED) {
            throw new OptimizedResumeUnavailableException(
                    "Resume is not optimized yet (status: " + resume.getOptimizationStatus() + ").");
        }

        String path = format == DownloadFormat.PDF ? resume.getRenderedPath() : resume.getOptimizedPath();
        if (path == null || !Files.isRegularFile(Paths.get(path))) {
            throw new OptimizedResumeUnavailableException(
                    "Optimized " + format.getExtension() + " file is not available.");
        }
        return Paths.get(path);
    }
}
