package com.resumetailor.infrastructure.rendering;

import com.resumetailor.domain.optimization.model.ResumeDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PdfRenderingChainTest {

    private static final Path DOCX = Path.of("optimized.docx");
    private static final Path PDF = Path.of("optimized.pdf");
    private static final ResumeDocument DOC = ResumeDocument.ofTexts("Jane Doe");

    @Mock
    private PdfRenderingStrategy libreOffice;

    @Mock
    private PdfRenderingStrategy fallback;

    @Test
    @DisplayName("Unavailable strategy is skipped")
    void unavailable_skipped() {
        when(libreOffice.isAvailable()).thenReturn(false);
        when(fallback.isAvailable()).thenReturn(true);

        Optional<Path> result = new PdfRenderingChain(List.of(libreOffice, fallback)).render(DOCX, DOC, PDF);

        assertThat(result).contains(PDF);
        verify(libreOffice, never()).render(any(), any(), any());
        verify(fallback).render(DOCX, DOC, PDF);
    }

    @Test
    @DisplayName("Failing strategy falls through to the next one")
    void failure_falls_through() {
        when(libreOffice.isAvailable()).thenReturn(true);
        doThrow(new PdfRenderingException("soffice missing")).when(libreOffice).render(DOCX, DOC, PDF);
        when(fallback.isAvailable()).thenReturn(true);

        Optional<Path> result = new PdfRenderingChain(List.of(libreOffice, fallback)).render(DOCX, DOC, PDF);

        assertThat(result).contains(PDF);
        verify(fallback).render(DOCX, DOC, PDF);
    }

    @Test
    @DisplayName("First success stops the chain")
    void first_success_wins() {
        when(libreOffice.isAvailable()).thenReturn(true);

        Optional<Path> result = new PdfRenderingChain(List.of(libreOffice, fallback)).render(DOCX, DOC, PDF);

        assertThat(result).contains(PDF);
        verify(fallback, never()).isAvailable();
    }

    @Test
    @DisplayName("Every strategy failing -> empty result, no exception")
    void all_fail() {
        when(libreOffice.isAvailable()).thenReturn(true);
        doThrow(new PdfRenderingException("soffice missing")).when(libreOffice).render(DOCX, DOC, PDF);
        when(fallback.isAvailable()).thenReturn(false);

        Optional<Path> result = new PdfRenderingChain(List.of(libreOffice, fallback)).render(DOCX, DOC, PDF);

        assertThat(result).isEmpty();
    }
}
