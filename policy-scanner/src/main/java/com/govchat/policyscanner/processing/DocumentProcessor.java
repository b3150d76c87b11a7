package com.govchat.policyscanner.processing;

import com.govchat.policyscanner.model.DocumentType;
import com.govchat.policyscanner.scraper.validation.Validators;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a stored document file into cleaned text, chunks, a content hash
 * and a short summary.
 */
@Slf4j
public class DocumentProcessor {

    public static final int DEFAULT_MAX_CHUNK_SIZE = 10_000;
    public static final int DEFAULT_OVERLAP_SIZE = 200;
    public static final int DEFAULT_SUMMARY_LENGTH = 500;

    private static final Pattern MULTIPLE_SPACES = Pattern.compile(" {2,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Map<DocumentType, TextExtractor> extractors = new EnumMap<>(DocumentType.class);
    private final TextChunker chunker;
    private final int summaryLength;

    public DocumentProcessor() {
        this(DEFAULT_MAX_CHUNK_SIZE, DEFAULT_OVERLAP_SIZE, DEFAULT_SUMMARY_LENGTH);
    }

    public DocumentProcessor(int maxChunkSize, int overlapSize, int summaryLength) {
        this(maxChunkSize, overlapSize, summaryLength,
                List.of(new PdfTextExtractor(), new HtmlTextExtractor(), new DocxTextExtractor()));
    }

    public DocumentProcessor(int maxChunkSize, int overlapSize, int summaryLength, List<TextExtractor> extractors) {
        this.chunker = new TextChunker(maxChunkSize, overlapSize);
        this.summaryLength = summaryLength;
        extractors.forEach(extractor -> this.extractors.put(extractor.supportedType(), extractor));
        log.info("DocumentProcessor initialized: max_chunk_size={}, overlap={}", maxChunkSize, overlapSize);
    }

    /**
     * Extracts and post-processes one file.
     *
     * @throws ProcessingException for a missing file, an unsupported type or
     *                             a file without text
     */
    public ProcessedDocument process(Path file, DocumentType type) {
        if (!Files.exists(file)) {
            throw new ProcessingException("File not found: " + file);
        }
        TextExtractor extractor = extractors.get(type);
        if (extractor == null) {
            throw new ProcessingException("Unsupported document type: " + type);
        }

        log.info("Processing document: {} (type: {})", file, type);
        TextExtractor.ExtractedText extracted;
        try {
            extracted = extractor.extract(file);
        } catch (ProcessingException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to process document {}: {}", file, e.getMessage(), e);
            throw new ProcessingException(type.value().toUpperCase(Locale.ROOT)
                    + " extraction failed: " + e.getMessage(), e);
        }

        String text = cleanText(extracted.text());
        if (text.isEmpty()) {
            throw new ProcessingException("No text left after cleaning " + file);
        }
        String contentHash = Validators.contentHash(text);
        List<String> chunks = chunker.chunk(text);
        String summary = summarize(text, summaryLength);
        int wordCount = countWords(text);

        log.info("Document processed: {} words, {} chunks, hash={}...",
                wordCount, chunks.size(), contentHash.substring(0, 16));
        return new ProcessedDocument(text, chunks, contentHash, summary, wordCount,
                extracted.pageCount(), chunks.size());
    }

    /**
     * Checks that {@code file} is an existing regular file. A mismatching
     * extension is only logged.
     */
    public boolean validateFile(Path file, DocumentType type) {
        if (!Files.exists(file)) {
            throw new ProcessingException("File not found: " + file);
        }
        if (!Files.isRegularFile(file)) {
            throw new ProcessingException("Not a file: " + file);
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
        if (!extension.equals(type.value())) {
            log.warn("File extension '{}' does not match document type '{}'", extension, type);
        }
        return true;
    }

    public boolean supports(DocumentType type) {
        return extractors.containsKey(type);
    }

    public TextChunker getChunker() {
        return chunker;
    }

    // ── Text utilities ───────────────────────────────────────────────────────

    /**
     * Trims every line, drops empty lines and squeezes runs of spaces.
     */
    public static String cleanText(String text) {
        String joined = text.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
        while (joined.contains("\n\n\n")) {
            joined = joined.replace("\n\n\n", "\n\n");
        }
        return MULTIPLE_SPACES.matcher(joined).replaceAll(" ").strip();
    }

    /**
     * First {@code maxLength} characters, cut back to the last sentence end
     * when one lies in the second half, otherwise followed by "...".
     */
    public static String summarize(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        String truncated = text.substring(0, maxLength);
        int lastPeriod = truncated.lastIndexOf(". ");
        if (lastPeriod > maxLength / 2) {
            return truncated.substring(0, lastPeriod + 1);
        }
        return truncated + "...";
    }

    static int countWords(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? 0 : WHITESPACE.split(stripped).length;
    }
}
