package com.govchat.policyscanner.processing;

import com.govchat.policyscanner.model.DocumentType;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DocumentProcessorTest {

    @TempDir
    Path tempDir;

    private final DocumentProcessor processor = new DocumentProcessor();

    @Test
    void process_Html_DropsScriptsAndPageChrome() throws IOException {
        // Given
        Path file = tempDir.resolve("besluit.html");
        Files.writeString(file, """
                <html>
                <head><title>Besluit</title><script>var tracking = 1;</script><style>.a { color: red; }</style></head>
                <body>
                <nav>Menu Home Contact</nav>
                <h1>Besluit parkeren</h1>
                <p>De raad besluit   tot invoering.</p>
                <footer>Gemeente Utrecht</footer>
                </body>
                </html>
                """, StandardCharsets.UTF_8);

        // When
        ProcessedDocument result = processor.process(file, DocumentType.HTML);

        // Then
        assertTrue(result.text().contains("Besluit parkeren"));
        assertTrue(result.text().contains("De raad besluit tot invoering."));
        assertFalse(result.text().contains("tracking"));
        assertFalse(result.text().contains("Menu"));
        assertFalse(result.text().contains("Gemeente Utrecht"));
        assertTrue(result.contentHash().matches("[0-9a-f]{64}"));
        assertNull(result.pageCount());
        assertEquals(1, result.chunkCount());
        assertEquals(result.chunks().size(), result.chunkCount());
    }

    @Test
    void process_Pdf_CountsPages() throws IOException {
        // Given
        Path file = tempDir.resolve("verordening.pdf");
        writePdf(file, "Artikel 1 Begripsbepalingen", "Artikel 2 Tarieven");

        // When
        ProcessedDocument result = processor.process(file, DocumentType.PDF);

        // Then
        assertEquals(2, result.pageCount());
        assertTrue(result.text().contains("Artikel 1 Begripsbepalingen"));
        assertTrue(result.text().contains("Artikel 2 Tarieven"));
        assertEquals(6, result.wordCount());
    }

    @Test
    void process_PdfWithoutText_Fails() throws IOException {
        // Given
        Path file = tempDir.resolve("scan.pdf");
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            document.save(file.toFile());
        }

        // When
        ProcessingException e = assertThrows(ProcessingException.class,
                () -> processor.process(file, DocumentType.PDF));

        // Then
        assertEquals("No text could be extracted from PDF", e.getMessage());
    }

    @Test
    void process_Docx_ReadsParagraphsAndTables() throws IOException {
        // Given
        Path file = tempDir.resolve("regeling.docx");
        try (XWPFDocument document = new XWPFDocument();
             OutputStream out = Files.newOutputStream(file)) {
            document.createParagraph().createRun().setText("Subsidieregeling duurzaamheid");
            XWPFTable table = document.createTable(1, 2);
            table.getRow(0).getCell(0).setText("Isolatie");
            table.getRow(0).getCell(1).setText("50 procent");
            document.write(out);
        }

        // When
        ProcessedDocument result = processor.process(file, DocumentType.DOCX);

        // Then
        assertTrue(result.text().startsWith("Subsidieregeling duurzaamheid"));
        assertTrue(result.text().contains("Isolatie"));
        assertTrue(result.text().contains("50 procent"));
    }

    @Test
    void process_SameTextInDifferentFormats_HasSameHash() throws IOException {
        // Given
        Path html = tempDir.resolve("a.html");
        Files.writeString(html, "<html><body><p>Dezelfde tekst.</p></body></html>");
        Path docx = tempDir.resolve("a.docx");
        try (XWPFDocument document = new XWPFDocument();
             OutputStream out = Files.newOutputStream(docx)) {
            document.createParagraph().createRun().setText("Dezelfde tekst.");
            document.write(out);
        }

        // When
        String htmlHash = processor.process(html, DocumentType.HTML).contentHash();
        String docxHash = processor.process(docx, DocumentType.DOCX).contentHash();

        // Then
        assertEquals(htmlHash, docxHash);
    }

    @Test
    void process_LongText_IsChunked() throws IOException {
        // Given
        DocumentProcessor small = new DocumentProcessor(200, 20, 50);
        Path file = tempDir.resolve("lang.html");
        Files.writeString(file, "<html><body><p>" + "Dit is een zin. ".repeat(60) + "</p></body></html>");

        // When
        ProcessedDocument result = small.process(file, DocumentType.HTML);

        // Then
        assertTrue(result.chunkCount() > 1);
        assertTrue(result.chunks().stream().allMatch(c -> c.length() <= 200));
        assertTrue(result.summary().length() <= 53);
    }

    @Test
    void process_MissingFile_Fails() {
        ProcessingException e = assertThrows(ProcessingException.class,
                () -> processor.process(tempDir.resolve("weg.pdf"), DocumentType.PDF));
        assertTrue(e.getMessage().startsWith("File not found"));
    }

    @Test
    void process_UnsupportedType_Fails() throws IOException {
        Path file = tempDir.resolve("tabel.xlsx");
        Files.write(file, new byte[]{1, 2, 3});

        assertThrows(ProcessingException.class, () -> processor.process(file, DocumentType.XLSX));
        assertFalse(processor.supports(DocumentType.XLSX));
        assertTrue(processor.supports(DocumentType.PDF));
    }

    @Test
    void validateFile_RejectsDirectories() {
        assertThrows(ProcessingException.class, () -> processor.validateFile(tempDir, DocumentType.PDF));
    }

    @Test
    void validateFile_MismatchedExtension_IsOnlyAWarning() throws IOException {
        Path file = tempDir.resolve("document.txt");
        Files.writeString(file, "tekst");

        assertTrue(processor.validateFile(file, DocumentType.PDF));
    }

    @Test
    void cleanText_TrimsLinesAndSqueezesSpaces() {
        assertEquals("regel een\nregel twee", DocumentProcessor.cleanText("  regel   een  \n\n\n   regel twee \n"));
    }

    @Test
    void summarize_CutsAtSentenceOrAddsEllipsis() {
        assertEquals("Kort.", DocumentProcessor.summarize("Kort.", 100));
        assertEquals("Eerste zin is lang genoeg.",
                DocumentProcessor.summarize("Eerste zin is lang genoeg. Tweede zin volgt hier", 30));
        assertEquals("abcdefghij...", DocumentProcessor.summarize("abcdefghijklmnop", 10));
    }

    @Test
    void countWords_SplitsOnWhitespace() {
        assertEquals(3, DocumentProcessor.countWords(" een  twee\ndrie "));
        assertEquals(0, DocumentProcessor.countWords("   "));
    }

    private static void writePdf(Path file, String... pages) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String text : pages) {
                PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(font, 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(text);
                    content.endText();
                }
            }
            document.save(file.toFile());
        }
    }
}
