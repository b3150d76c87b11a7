package com.govchat.policyscanner.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each source ingest run for observability.
 * Stored in the scrape_runs table.
 */
@Data
@Builder
public class ScrapeRun {

    private String runId;           // UUID
    private String sourceId;
    private String plugin;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | PARTIAL | FAILED
    private int documentsFound;
    private int documentsStored;
    private String errorMessage;    // null on success
}
