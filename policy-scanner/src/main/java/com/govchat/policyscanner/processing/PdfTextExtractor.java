package com.govchat.policyscanner.processing;

import com.govchat.policyscanner.model.DocumentType;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts text page by page with PDFBox. Pages without text are dropped;
 * a page that fails to extract is logged and skipped.
 */
@Slf4j
public class PdfTextExtractor implements TextExtractor {

    @Override
    public DocumentType supportedType() {
        return DocumentType.PDF;
    }

    @Override
    public ExtractedText extract(Path file) throws IOException {
        try (PDDocument document = Loader.loadPDF(file.toFile())) {
            int pageCount = document.getNumberOfPages();
            log.debug("PDF has {} pages", pageCount);

            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>();
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                try {
                    String pageText = stripper.getText(document);
                    if (pageText != null && !pageText.isBlank()) {
                        pages.add(pageText);
                    }
                } catch (IOException e) {
                    log.warn("Failed to extract page {} of {}: {}", pageNumber, file, e.getMessage());
                }
            }

            if (pages.isEmpty()) {
                throw new ProcessingException("No text could be extracted from PDF");
            }
            String text = String.join("\n\n", pages);
            log.debug("Extracted {} characters from PDF", text.length());
            return new ExtractedText(text, pageCount);
        }
    }
}
