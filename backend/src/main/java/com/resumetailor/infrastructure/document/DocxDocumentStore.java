package com.resumetailor.infrastructure.document;

import com.resumetailor.domain.optimization.model.Paragraph;
import com.resumetailor.domain.optimization.model.ParagraphFormatting;
import com.resumetailor.domain.optimization.model.ResumeDocument;
import com.resumetailor.domain.optimization.service.DocumentStore;
import com.resumetailor.infrastructure.optimization.ResumeInputException;
import com.resumetailor.infrastructure.optimization.ResumeOutputException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes .docx resumes with Apache POI.
 *
 * One {@link Paragraph} per body paragraph, in document order. Formatting is captured from
 * the paragraph properties and from its first run, and written back onto a single run.
 */
@Slf4j
@Component
public class DocxDocumentStore implements DocumentStore {

    @Override
    public ResumeDocument read(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new ResumeInputException("Resume file not found: " + source);
        }

        try (InputStream in = Files.newInputStream(source);
             XWPFDocument doc = new XWPFDocument(in)) {

            List<Paragraph> paragraphs = new ArrayList<>();
            for (XWPFParagraph para : doc.getParagraphs()) {
                paragraphs.add(new Paragraph(para.getText(), readFormatting(para)));
            }
            log.debug("Read {} paragraphs from {}", paragraphs.size(), source);
            return new ResumeDocument(paragraphs);
        } catch (IOException | RuntimeException e) {
            throw new ResumeInputException("Resume file could not be read: " + source.getFileName(), e);
        }
    }

    @Override
    public void write(ResumeDocument document, Path target) {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "resume-", ".docx.tmp");

            try (XWPFDocument doc = new XWPFDocument();
                 OutputStream out = Files.newOutputStream(temp)) {
                for (Paragraph paragraph : document.paragraphs()) {
                    writeParagraph(doc.createParagraph(), paragraph);
                }
                doc.write(out);
            }

            moveIntoPlace(temp, target);
            log.debug("Wrote {} paragraphs to {}", document.size(), target);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(temp);
            throw new ResumeOutputException("Optimized resume could not be written: " + target.getFileName(), e);
        }
    }

    private ParagraphFormatting readFormatting(XWPFParagraph para) {
        ParagraphAlignment alignment = para.getAlignment();
        List<XWPFRun> runs = para.getRuns();
        XWPFRun run = runs.isEmpty() ? null : runs.get(0);

        boolean bold = false;
        boolean italic = false;
        String underline = null;
        String fontFamily = null;
        double fontSize = -1;
        String color = null;
        if (run != null) {
            bold = run.isBold();
            italic = run.isItalic();
            UnderlinePatterns pattern = run.getUnderline();
            underline = pattern != null && pattern != UnderlinePatterns.NONE ? pattern.name() : null;
            fontFamily = run.getFontFamily();
            Double size = run.getFontSizeAsDouble();
            fontSize = size != null ? size : -1;
            color = run.getColor();
        }

        return new ParagraphFormatting(
                alignment != null ? alignment.name() : null,
                para.getIndentationLeft(),
                para.getIndentationFirstLine(),
                para.getSpacingBefore(),
                para.getSpacingAfter(),
                para.getStyle(),
                bold, italic, underline, fontFamily, fontSize, color);
    }

    private void writeParagraph(XWPFParagraph para, Paragraph paragraph) {
        ParagraphFormatting f = paragraph.formatting();

        if (f.alignment() != null) {
            para.setAlignment(ParagraphAlignment.valueOf(f.alignment()));
        }
        if (f.indentationLeft() >= 0) {
            para.setIndentationLeft(f.indentationLeft());
        }
        if (f.indentationFirstLine() >= 0) {
            para.setIndentationFirstLine(f.indentationFirstLine());
        }
        if (f.spacingBefore() >= 0) {
            para.setSpacingBefore(f.spacingBefore());
        }
        if (f.spacingAfter() >= 0) {
            para.setSpacingAfter(f.spacingAfter());
        }
        if (f.styleId() != null) {
            para.setStyle(f.styleId());
        }

        if (paragraph.text().isEmpty()) {
            return;
        }
        XWPFRun run = para.createRun();
        run.setText(paragraph.text());
        run.setBold(f.bold());
        run.setItalic(f.italic());
        if (f.underline() != null) {
            run.setUnderline(UnderlinePatterns.valueOf(f.underline()));
        }
        if (f.fontFamily() != null) {
            run.setFontFamily(f.fontFamily());
        }
        if (f.fontSize() > 0) {
            run.setFontSize(f.fontSize());
        }
        if (f.color() != null) {
            run.setColor(f.color());
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }
}
