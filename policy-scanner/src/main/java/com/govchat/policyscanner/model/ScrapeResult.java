package com.govchat.policyscanner.model;

import java.util.List;

/**
 * Outcome of one {@code scrape()} call. {@code success} is true exactly when
 * no error was recorded; documents gathered before a failure are still here.
 */
public record ScrapeResult(
        List<DocumentMetadata> documents,
        int totalFound,
        int pagesScraped,
        double durationSeconds,
        List<String> errors,
        boolean success) {

    public ScrapeResult {
        documents = List.copyOf(documents);
        errors = List.copyOf(errors);
    }

    public static ScrapeResult of(List<DocumentMetadata> documents, int pagesScraped,
                                  double durationSeconds, List<String> errors) {
        return new ScrapeResult(documents, documents.size(), pagesScraped, durationSeconds,
                errors, errors.isEmpty());
    }
}
