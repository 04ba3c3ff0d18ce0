package com.resumetailor.infrastructure.storage;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.UUID;

/**
 * File layout: uploads/{id}.docx for originals, optimized/{id}.docx and optimized/{id}.pdf
 * for results.
 */
@Slf4j
@Component
public class ResumeFileStorage {

    @Value("${storage.upload-dir:uploads}")
    private String uploadDir;

    @Value("${storage.optimized-dir:optimized}")
    private String optimizedDir;

    private Path uploadRoot;
    private Path optimizedRoot;

    @PostConstruct
    void init() {
        uploadRoot = Paths.get(uploadDir).toAbsolutePath().normalize();
        optimizedRoot = Paths.get(optimizedDir).toAbsolutePath().normalize();
        try {
            Files.createDirectories(uploadRoot);
            Files.createDirectories(optimizedRoot);
        } catch (IOException e) {
            throw new ResumeStorageException("Storage directories could not be created", e);
        }
        log.info("Resume storage - uploads: {}, optimized: {}", uploadRoot, optimizedRoot);
    }

    public Path storeUpload(UUID resumeId, InputStream content) {
        Path target = originalPath(resumeId);
        try (content) {
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            throw new ResumeStorageException("Uploaded resume could not be stored", e);
        }
    }

    public Path originalPath(UUID resumeId) {
        return uploadRoot.resolve(resumeId + ".docx");
    }

    public Path optimizedDocxPath(UUID resumeId) {
        return optimizedRoot.resolve(resumeId + ".docx");
    }

    public Path renderedPdfPath(UUID resumeId) {
        return optimizedRoot.resolve(resumeId + ".pdf");
    }

    public List<Path> roots() {
        return List.of(uploadRoot, optimizedRoot);
    }
}
