package com.govchat.policyscanner.processing;

import com.govchat.policyscanner.model.DocumentType;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Pulls raw text out of one file format.
 */
public interface TextExtractor {

    DocumentType supportedType();

    /**
     * @throws ProcessingException when the file holds no text
     * @throws IOException         when the file cannot be read or parsed
     */
    ExtractedText extract(Path file) throws IOException;

    /**
     * @param text      raw text, before cleaning
     * @param pageCount number of pages for paged formats, otherwise null
     */
    record ExtractedText(String text, Integer pageCount) {
    }
}
