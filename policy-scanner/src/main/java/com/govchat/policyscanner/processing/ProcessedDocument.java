package com.govchat.policyscanner.processing;

import java.util.List;

/**
 * Result of processing one document file.
 *
 * @param text        cleaned full text
 * @param chunks      text split for downstream indexing
 * @param contentHash SHA-256 of {@code text}, 64 lowercase hex characters
 * @param summary     leading excerpt of the text
 * @param wordCount   whitespace separated words in {@code text}
 * @param pageCount   page count for PDFs, otherwise null
 * @param chunkCount  size of {@code chunks}
 */
public record ProcessedDocument(
        String text,
        List<String> chunks,
        String contentHash,
        String summary,
        int wordCount,
        Integer pageCount,
        int chunkCount) {

    public ProcessedDocument {
        chunks = List.copyOf(chunks);
    }
}
