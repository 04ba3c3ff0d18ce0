package com.resumetailor.infrastructure.rendering;

import com.resumetailor.domain.optimization.model.ResumeDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Headless LibreOffice conversion; keeps the .docx layout.
 */
@Slf4j
@Order(1)
@Component
public class LibreOfficePdfConverter implements PdfRenderingStrategy {

    @Value("${rendering.libreoffice-enabled:false}")
    private boolean enabled;

    @Value("${rendering.libreoffice-command:soffice}")
    private String command;

    @Value("${rendering.libreoffice-timeout-seconds:60}")
    private long timeoutSeconds;

    @Override
    public String name() {
        return "LibreOffice";
    }

    @Override
    public boolean isAvailable() {
        return enabled;
    }

    @Override
    public void render(Path docx, ResumeDocument document, Path target) {
        Path outDir = null;
        try {
            outDir = Files.createTempDirectory("resume-render-");
            // Written to a file so a chatty process never fills the pipe and stalls
            Path logFile = outDir.resolve("soffice.log");
            Process process = new ProcessBuilder(List.of(
                    command, "--headless", "--convert-to", "pdf",
                    "--outdir", outDir.toString(), docx.toAbsolutePath().toString()))
                    .redirectErrorStream(true)
                    .redirectOutput(logFile.toFile())
                    .start();

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new PdfRenderingException("LibreOffice timed out after " + timeoutSeconds + "s");
            }
            String output = Files.readString(logFile, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new PdfRenderingException("LibreOffice exited with " + process.exitValue() + ": " + output.strip());
            }

            Path produced = outDir.resolve(baseName(docx) + ".pdf");
            if (!Files.isRegularFile(produced)) {
                throw new PdfRenderingException("LibreOffice produced no PDF: " + output.strip());
            }
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.move(produced, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new PdfRenderingException("LibreOffice could not be run: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PdfRenderingException("LibreOffice conversion interrupted", e);
        } finally {
            cleanUp(outDir);
        }
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private void cleanUp(Path dir) {
        if (dir == null) {
            return;
        }
        try (var files = Files.list(dir)) {
            for (Path file : files.toList()) {
                Files.deleteIfExists(file);
            }
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
