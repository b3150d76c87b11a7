package com.govchat.policyscanner.service;

import com.govchat.policyscanner.config.PolicyScannerProperties;
import com.govchat.policyscanner.model.DiscoveryRequest;
import com.govchat.policyscanner.model.DocumentMetadata;
import com.govchat.policyscanner.model.DocumentType;
import com.govchat.policyscanner.model.PolicyDocument;
import com.govchat.policyscanner.model.ScrapeResult;
import com.govchat.policyscanner.model.ScrapeRun;
import com.govchat.policyscanner.model.ScraperConfig;
import com.govchat.policyscanner.output.DiscoveryCsvWriter;
import com.govchat.policyscanner.scraper.PluginRegistry;
import com.govchat.policyscanner.scraper.ScraperPlugin;
import com.govchat.policyscanner.scraper.validation.Validators;
import com.govchat.policyscanner.store.DocumentStore;
import com.govchat.policyscanner.store.DuplicateDocumentException;
import com.govchat.policyscanner.store.ScrapeRunLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one configured source end to end: discover, download what is new,
 * store the file and persist a pending document for the indexer.
 *
 * A document that fails to download is logged and counted; the run goes on.
 * Every run leaves a row in scrape_runs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SourceIngestService {

    private final PolicyScannerProperties properties;
    private final PluginRegistry pluginRegistry;
    private final DocumentStore documentStore;
    private final ScrapeRunLog scrapeRunLog;
    private final DiscoveryCsvWriter csvWriter;

    private enum Outcome { STORED, SKIPPED, FAILED }

    public record IngestResult(String sourceId, String runId, String status,
                               int found, int stored, int skipped, int failed, List<String> errors) {
    }

    /** Ingests every enabled source, one after the other. */
    public List<IngestResult> ingestAll() {
        List<IngestResult> results = new ArrayList<>();
        for (PolicyScannerProperties.Source source : properties.getSources()) {
            if (!source.isEnabled()) {
                log.debug("Source {} is disabled, skipping", source.getId());
                continue;
            }
            results.add(ingest(source));
        }
        log.info("Ingest of {} sources complete", results.size());
        return results;
    }

    /**
     * @throws IllegalArgumentException when no source with that id is configured
     */
    public IngestResult ingest(String sourceId) {
        PolicyScannerProperties.Source source = findSource(sourceId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown source: " + sourceId));
        return ingest(source);
    }

    public Optional<PolicyScannerProperties.Source> findSource(String sourceId) {
        return properties.getSources().stream()
                .filter(s -> s.getId() != null && s.getId().equals(sourceId))
                .findFirst();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private IngestResult ingest(PolicyScannerProperties.Source source) {
        log.info("Ingesting source {} with plugin {}", source.getId(), source.getPlugin());

        ScrapeRun run = ScrapeRun.builder()
                .runId(UUID.randomUUID().toString())
                .sourceId(source.getId())
                .plugin(source.getPlugin())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();

        List<String> errors = new ArrayList<>();
        int stored = 0;
        int skipped = 0;
        int failed = 0;

        try {
            ScraperPlugin plugin = pluginRegistry.get(source.getPlugin(), toScraperConfig(source));
            ScrapeResult result = plugin.scrape(toDiscoveryRequest(source));
            errors.addAll(result.errors());
            run.setDocumentsFound(result.totalFound());
            log.info("Source {}: {} documents discovered on {} pages", source.getId(),
                    result.totalFound(), result.pagesScraped());

            if (properties.getOutput().getCsv().isEnabled()) {
                csvWriter.write(source.getId(), result.documents());
            }

            for (DocumentMetadata metadata : result.documents()) {
                if (Thread.currentThread().isInterrupted()) {
                    errors.add("Ingest interrupted");
                    break;
                }
                Outcome outcome = storeDocument(source, plugin, metadata, errors);
                switch (outcome) {
                    case STORED -> stored++;
                    case SKIPPED -> skipped++;
                    case FAILED -> failed++;
                }
            }

            run.setStatus(errors.isEmpty() ? "SUCCESS" : "PARTIAL");
            if (!errors.isEmpty()) {
                run.setErrorMessage(String.join("; ", errors));
            }

        } catch (Exception e) {
            log.error("Ingest of source {} failed: {}", source.getId(), e.getMessage(), e);
            errors.add(e.getMessage());
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setDocumentsStored(stored);
            run.setCompletedAt(LocalDateTime.now());
            scrapeRunLog.write(run);
        }

        log.info("Source {}: {} stored, {} skipped, {} failed (status {})",
                source.getId(), stored, skipped, failed, run.getStatus());
        return new IngestResult(source.getId(), run.getRunId(), run.getStatus(),
                run.getDocumentsFound(), stored, skipped, failed, errors);
    }

    private Outcome storeDocument(PolicyScannerProperties.Source source, ScraperPlugin plugin,
                                  DocumentMetadata metadata, List<String> errors) {
        if (documentStore.findByExternalId(source.getId(), metadata.getExternalId()).isPresent()) {
            log.debug("Already stored: {} ({})", metadata.getTitle(), metadata.getExternalId());
            return Outcome.SKIPPED;
        }

        try {
            byte[] content = plugin.downloadDocument(metadata);

            DocumentType type = metadata.getDocumentType();
            if (type == DocumentType.UNKNOWN) {
                type = Validators.detectDocumentType(content);
            }

            // provisional hash over the raw bytes; the indexer replaces it with the text hash
            String contentHash = Validators.contentHash(content);
            Optional<PolicyDocument> identical = documentStore.findByContentHash(contentHash);
            if (identical.isPresent()) {
                log.info("Skipping {}: identical to stored document {}", metadata.getUrl(), identical.get().getId());
                return Outcome.SKIPPED;
            }

            String documentId = UUID.randomUUID().toString();
            Path file = writeFile(source.getId(), documentId, type, content);

            Map<String, Object> documentMetadata = new HashMap<>(metadata.getMetadata());
            documentMetadata.put(PolicyDocument.META_FILE_PATH, file.toString());

            PolicyDocument document = PolicyDocument.builder()
                    .id(documentId)
                    .sourceId(source.getId())
                    .externalId(metadata.getExternalId())
                    .title(metadata.getTitle())
                    .description(metadata.getDescription())
                    .contentHash(contentHash)
                    .documentUrl(metadata.getUrl())
                    .documentType(type)
                    .municipality(metadata.getMunicipality())
                    .publicationDate(metadata.getPublicationDate())
                    .effectiveDate(metadata.getEffectiveDate())
                    .fileSize((long) content.length)
                    .metadata(documentMetadata)
                    .build();

            try {
                documentStore.insert(document);
            } catch (DuplicateDocumentException e) {
                log.info("Skipping {}: {}", metadata.getUrl(), e.getMessage());
                Files.deleteIfExists(file);
                return Outcome.SKIPPED;
            }
            return Outcome.STORED;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            errors.add("Download interrupted: " + metadata.getUrl());
            return Outcome.FAILED;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to ingest {}: {}", metadata.getUrl(), e.getMessage());
            errors.add("Download failed for " + metadata.getUrl() + ": " + e.getMessage());
            return Outcome.FAILED;
        }
    }

    private Path writeFile(String sourceId, String documentId, DocumentType type, byte[] content) throws IOException {
        Path directory = Paths.get(properties.getStoragePath(), Validators.sanitizeFilename(sourceId));
        Files.createDirectories(directory);
        Path file = directory.resolve(documentId + "." + type.value());
        Files.write(file, content);
        log.debug("Wrote {} bytes to {}", content.length, file);
        return file;
    }

    static ScraperConfig toScraperConfig(PolicyScannerProperties.Source source) {
        return ScraperConfig.builder()
                .baseUrl(source.getBaseUrl())
                .rateLimit(source.getRateLimit())
                .crawlDelay(source.getCrawlDelay())
                .timeout(source.getTimeout())
                .maxRetries(source.getMaxRetries())
                .emptyPageThreshold(source.getEmptyPageThreshold())
                .userAgent(source.getUserAgent())
                .selectors(source.getSelectors())
                .headers(source.getHeaders())
                .authConfig(source.getAuthConfig())
                .customParams(source.getCustomParams())
                .build();
    }

    static DiscoveryRequest toDiscoveryRequest(PolicyScannerProperties.Source source) {
        LocalDate startDate = source.getLookbackDays() != null
                ? LocalDate.now().minusDays(source.getLookbackDays())
                : null;
        return DiscoveryRequest.builder()
                .startDate(startDate)
                .maxPages(source.getMaxPages())
                .params(source.getParams())
                .build();
    }
}
