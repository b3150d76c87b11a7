package com.govchat.policyscanner.scheduler;

import com.govchat.policyscanner.config.PolicyScannerProperties;
import com.govchat.policyscanner.indexing.IndexingRequest;
import com.govchat.policyscanner.indexing.IndexingService;
import com.govchat.policyscanner.model.IndexingStats;
import com.govchat.policyscanner.search.IndexSettings;
import com.govchat.policyscanner.search.SearchIndex;
import com.govchat.policyscanner.service.SourceIngestService;
import com.govchat.policyscanner.store.DocumentStore;
import com.govchat.policyscanner.store.ScrapeRunLog;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup ingest.
 *
 * Default schedule: every day at 03:00 UTC. Each run ingests all enabled
 * sources and then indexes whatever is pending.
 *
 * Override with CRON env var or policy-scanner.scheduling.cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestScheduler {

    private final SourceIngestService ingestService;
    private final IndexingService indexingService;
    private final DocumentStore documentStore;
    private final ScrapeRunLog scrapeRunLog;
    private final SearchIndex searchIndex;
    private final PolicyScannerProperties properties;

    /**
     * On application startup:
     *  1. Ensure the database tables and the search index exist
     *  2. Optionally run a full cycle if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            documentStore.ensureSchema();
            scrapeRunLog.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise database schema: {}", e.getMessage());
        }

        try {
            searchIndex.createIndex(IndexSettings.policyDocuments());
        } catch (Exception e) {
            log.warn("Could not initialise search index (is Meilisearch running?): {}", e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running ingest and indexing now");
            runCycle();
        } else {
            log.info("Policy scanner ready. Next scheduled run: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${policy-scanner.scheduling.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled ingest triggered");
        runCycle();
    }

    void runCycle() {
        try {
            ingestService.ingestAll();
        } catch (Exception e) {
            log.error("Scheduled ingest failed: {}", e.getMessage(), e);
        }
        try {
            IndexingStats stats = indexingService.run(IndexingRequest.pending());
            log.info("Indexing finished: {} indexed, {} failed, {} skipped in {}s",
                    stats.getIndexed(), stats.getFailed(), stats.getSkipped(), stats.getDurationSeconds());
        } catch (Exception e) {
            log.error("Scheduled indexing failed: {}", e.getMessage(), e);
        }
    }
}
