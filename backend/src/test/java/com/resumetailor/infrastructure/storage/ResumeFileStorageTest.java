package com.resumetailor.infrastructure.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ResumeFileStorageTest {

    @TempDir
    Path tempDir;

    private ResumeFileStorage storage;

    @BeforeEach
    void setUp() {
        storage = new ResumeFileStorage();
        ReflectionTestUtils.setField(storage, "uploadDir", tempDir.resolve("uploads").toString());
        ReflectionTestUtils.setField(storage, "optimizedDir", tempDir.resolve("optimized").toString());
        storage.init();
    }

    @Test
    @DisplayName("init creates both directories")
    void directories_created() {
        assertThat(tempDir.resolve("uploads")).isDirectory();
        assertThat(tempDir.resolve("optimized")).isDirectory();
        assertThat(storage.roots()).hasSize(2);
    }

    @Test
    @DisplayName("Upload is stored under its id")
    void store_upload() throws Exception {
        UUID id = UUID.randomUUID();

        Path stored = storage.storeUpload(id, new ByteArrayInputStream("docx".getBytes(StandardCharsets.UTF_8)));

        assertThat(stored).isEqualTo(storage.originalPath(id));
        assertThat(stored.getFileName().toString()).isEqualTo(id + ".docx");
        assertThat(Files.readString(stored)).isEqualTo("docx");
    }

    @Test
    @DisplayName("Optimized outputs share the id and differ by extension")
    void output_paths() {
        UUID id = UUID.randomUUID();

        assertThat(storage.optimizedDocxPath(id).getFileName().toString()).isEqualTo(id + ".docx");
        assertThat(storage.renderedPdfPath(id).getFileName().toString()).isEqualTo(id + ".pdf");
        assertThat(storage.optimizedDocxPath(id).getParent()).isEqualTo(tempDir.resolve("optimized").toAbsolutePath());
    }
}
