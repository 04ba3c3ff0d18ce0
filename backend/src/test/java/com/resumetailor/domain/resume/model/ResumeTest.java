package com.resumetailor.domain.resume.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResumeTest {

    @Test
    @DisplayName("New resume is PENDING and owned by its user")
    void new_resume() {
        Resume resume = Resume.builder().userId("user-1").originalFilename("resume.docx").build();

        assertThat(resume.getId()).isNotNull();
        assertThat(resume.getOptimizationStatus()).isEqualTo(OptimizationStatus.PENDING);
        assertThat(resume.isOwnedBy("user-1")).isTrue();
        assertThat(resume.isOwnedBy("user-2")).isFalse();
    }

    @Test
    @DisplayName("Upload -> optimize -> complete")
    void lifecycle() {
        Resume resume = Resume.builder().userId("user-1").originalFilename("resume.docx").build();

        resume.markUploaded("uploads/a.docx");
        assertThat(resume.getOptimizationStatus()).isEqualTo(OptimizationStatus.UPLOADED);

        resume.startOptimization("Platform engineer");
        assertThat(resume.getOptimizationStatus()).isEqualTo(OptimizationStatus.PROCESSING);

        resume.completeOptimization("optimized/a.docx", "optimized/a.pdf", 5);
        assertThat(resume.getOptimizationStatus()).isEqualTo(OptimizationStatus.COMPLETED);
        assertThat(resume.getKeywordsAdded()).isEqualTo(5);
        assertThat(resume.getRenderedPath()).isEqualTo("optimized/a.pdf");
    }

    @Test
    @DisplayName("A new attempt clears the previous failure")
    void retry_after_failure() {
        Resume resume = Resume.builder().userId("user-1").originalFilename("resume.docx").build();
        resume.markUploaded("uploads/a.docx");
        resume.startOptimization("jd");
        resume.failOptimization("Resume contains no text");
        assertThat(resume.getFailureReason()).isEqualTo("Resume contains no text");

        resume.startOptimization("jd");

        assertThat(resume.getFailureReason()).isNull();
        assertThat(resume.getOptimizationStatus()).isEqualTo(OptimizationStatus.PROCESSING);
    }
}
