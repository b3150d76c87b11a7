package com.govchat.policyscanner.processing;

import com.govchat.policyscanner.model.DocumentType;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Body paragraphs first, then table cells, each non-empty piece separated by
 * a blank line.
 */
@Slf4j
public class DocxTextExtractor implements TextExtractor {

    @Override
    public DocumentType supportedType() {
        return DocumentType.DOCX;
    }

    @Override
    public ExtractedText extract(Path file) throws IOException {
        List<String> parts = new ArrayList<>();
        try (InputStream in = Files.newInputStream(file);
             XWPFDocument document = new XWPFDocument(in)) {

            for (XWPFParagraph paragraph : document.getParagraphs()) {
                String text = paragraph.getText();
                if (text != null && !text.isBlank()) {
                    parts.add(text);
                }
            }
            for (XWPFTable table : document.getTables()) {
                for (XWPFTableRow row : table.getRows()) {
                    for (XWPFTableCell cell : row.getTableCells()) {
                        String text = cell.getText();
                        if (text != null && !text.isBlank()) {
                            parts.add(text);
                        }
                    }
                }
            }
        }

        if (parts.isEmpty()) {
            throw new ProcessingException("No text could be extracted from DOCX");
        }
        String text = String.join("\n\n", parts);
        log.debug("Extracted {} characters from DOCX", text.length());
        return new ExtractedText(text, null);
    }
}
