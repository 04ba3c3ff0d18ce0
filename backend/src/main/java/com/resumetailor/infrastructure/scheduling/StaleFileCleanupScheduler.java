package com.resumetailor.infrastructure.scheduling;

import com.resumetailor.infrastructure.storage.ResumeFileStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

@Component
@RequiredArgsConstructor
@Slf4j
public class StaleFileCleanupScheduler {

    private final ResumeFileStorage storage;

    @Value("${storage.retention-days:7}")
    private int retentionDays;

    @Scheduled(fixedRate = 3600000)
    public void cleanupStaleFiles() {
        Instant cutoff = Instant.now().minus(Duration.ofDays(retentionDays));
        int deleted = 0;
        for (Path root : storage.roots()) {
            deleted += deleteOlderThan(root, cutoff);
        }
        log.debug("Cleaned up {} resume files older than {} days", deleted, retentionDays);
    }

    int deleteOlderThan(Path root, Instant cutoff) {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(root)) {
            files = stream.filter(Files::isRegularFile).toList();
        } catch (IOException e) {
            log.warn("Could not list {}: {}", root, e.getMessage());
            return 0;
        }

        int deleted = 0;
        for (Path file : files) {
            try {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                    Files.deleteIfExists(file);
                    deleted++;
                }
            } catch (IOException e) {
                log.warn("Could not delete stale file {}: {}", file, e.getMessage());
            }
        }
        return deleted;
    }
}
