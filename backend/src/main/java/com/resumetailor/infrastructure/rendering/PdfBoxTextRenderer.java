package com.resumetailor.infrastructure.rendering;

import com.resumetailor.domain.optimization.model.Paragraph;
import com.resumetailor.domain.optimization.model.ResumeDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Plain-text PDF: Helvetica 11pt, word wrap, pagination. Bold paragraphs use Helvetica-Bold.
 * Always available, so it is the last resort of the chain.
 */
@Slf4j
@Order(2)
@Component
public class PdfBoxTextRenderer implements PdfRenderingStrategy {

    static final float FONT_SIZE = 11f;
    private static final float LEADING = 1.35f * FONT_SIZE;
    private static final float MARGIN = 54f;
    private static final char REPLACEMENT = '?';

    @Override
    public String name() {
        return "PDFBox";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void render(Path docx, ResumeDocument document, Path target) {
        PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        PDRectangle pageSize = PDRectangle.A4;
        float width = pageSize.getWidth() - 2 * MARGIN;

        try (PDDocument pdf = new PDDocument()) {
            List<Line> lines = new ArrayList<>();
            for (Paragraph paragraph : document.paragraphs()) {
                PDFont font = paragraph.formatting().bold() ? bold : regular;
                String text = sanitize(paragraph.text(), font);
                if (text.isBlank()) {
                    lines.add(new Line("", font));
                    continue;
                }
                for (String wrapped : wrap(text, font, width)) {
                    lines.add(new Line(wrapped, font));
                }
            }

            writePages(pdf, pageSize, lines);
            Files.createDirectories(target.toAbsolutePath().getParent());
            pdf.save(target.toFile());
            log.debug("Rendered {} lines on {} pages to {}", lines.size(), pdf.getNumberOfPages(), target);
        } catch (IOException e) {
            throw new PdfRenderingException("PDFBox rendering failed: " + e.getMessage(), e);
        }
    }

    private record Line(String text, PDFont font) {
    }

    private void writePages(PDDocument pdf, PDRectangle pageSize, List<Line> lines) throws IOException {
        int linesPerPage = Math.max(1, (int) ((pageSize.getHeight() - 2 * MARGIN) / LEADING));
        int index = 0;
        do {
            PDPage page = new PDPage(pageSize);
            pdf.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(pdf, page)) {
                content.beginText();
                content.setLeading(LEADING);
                content.newLineAtOffset(MARGIN, pageSize.getHeight() - MARGIN);
                int end = Math.min(lines.size(), index + linesPerPage);
                for (; index < end; index++) {
                    Line line = lines.get(index);
                    content.setFont(line.font(), FONT_SIZE);
                    content.showText(line.text());
                    content.newLine();
                }
                content.endText();
            }
        } while (index < lines.size());
    }

    List<String> wrap(String text, PDFont font, float maxWidth) throws IOException {
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String word : text.strip().split("\\s+")) {
            String candidate = current.length() == 0 ? word : current + " " + word;
            if (widthOf(candidate, font) <= maxWidth || current.length() == 0) {
                current.setLength(0);
                current.append(candidate);
            } else {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
        }
        if (current.length() > 0) {
            lines.add(current.toString());
        }
        return lines;
    }

    /**
     * Replace every character the font cannot encode; control characters become spaces.
     */
    String sanitize(String text, PDFont font) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            if (Character.isISOControl(cp) || Character.isWhitespace(cp)) {
                sb.append(' ');
                return;
            }
            String ch = new String(Character.toChars(cp));
            try {
                font.encode(ch);
                sb.append(ch);
            } catch (IOException | IllegalArgumentException e) {
                sb.append(REPLACEMENT);
            }
        });
        return sb.toString();
    }

    private static float widthOf(String text, PDFont font) throws IOException {
        return font.getStringWidth(text) / 1000 * FONT_SIZE;
    }
}
