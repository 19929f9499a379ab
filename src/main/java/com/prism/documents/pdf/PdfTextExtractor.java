package com.prism.documents.pdf;

import com.prism.documents.exception.ExtractionException;
import com.prism.documents.model.ExtractionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.StringJoiner;

/**
 * Page-ordered text extraction with baseline-aware line breaks, followed by
 * metadata detection on the result.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PdfTextExtractor {

    static final float BASELINE_THRESHOLD = 2.0f;

    private final MetadataDetector metadataDetector;

    public ExtractionResult extract(byte[] pdf) {
        if (pdf == null || pdf.length == 0) {
            throw new ExtractionException("PDF content is empty");
        }

        try (PDDocument document = Loader.loadPDF(pdf)) {
            int pageCount = document.getNumberOfPages();
            if (pageCount == 0) {
                throw new ExtractionException("PDF has no pages");
            }

            LineAwareTextStripper stripper = new LineAwareTextStripper(BASELINE_THRESHOLD);
            StringJoiner text = new StringJoiner("\n");
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(document).replace("\u0000", "").strip();
                if (!pageText.isEmpty()) {
                    text.add(pageText);
                }
            }

            String fullText = text.toString();
            log.info("Extracted {} characters from {} pages", fullText.length(), pageCount);
            return new ExtractionResult(fullText, pageCount, metadataDetector.detect(fullText));
        } catch (IOException e) {
            throw new ExtractionException("Failed to parse PDF: " + e.getMessage(), e);
        }
    }
}
