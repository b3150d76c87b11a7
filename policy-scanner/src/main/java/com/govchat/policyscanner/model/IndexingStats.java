package com.govchat.policyscanner.model;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counters for one indexing run. processed always equals indexed + failed;
 * skipped documents are not processed.
 */
@Getter
public class IndexingStats {

    @Setter
    private int totalDocuments;
    private int processed;
    private int indexed;
    private int failed;
    private int skipped;
    private final Instant startedAt = Instant.now();
    private Instant finishedAt;
    private final List<IndexingError> errors = new ArrayList<>();

    public record IndexingError(String documentId, String error, Instant timestamp) {}

    public void recordSuccess() {
        processed++;
        indexed++;
    }

    public void recordFailure(String documentId, String error) {
        processed++;
        failed++;
        errors.add(new IndexingError(documentId, error, Instant.now()));
    }

    public void recordSkip() {
        skipped++;
    }

    /** Marks the run complete; the duration stops growing from here on. Later calls keep the first time. */
    public void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    /** Run length so far, or the final length once {@link #finish()} was called. */
    public double getDurationSeconds() {
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return Duration.between(startedAt, end).toMillis() / 1000.0;
    }

    public List<IndexingError> getErrors() {
        return Collections.unmodifiableList(errors);
    }
}
