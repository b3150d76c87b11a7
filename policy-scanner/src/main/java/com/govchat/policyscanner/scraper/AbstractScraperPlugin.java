package com.govchat.policyscanner.scraper;

import com.govchat.policyscanner.model.DiscoveryRequest;
import com.govchat.policyscanner.model.DocumentMetadata;
import com.govchat.policyscanner.model.ScrapeResult;
import com.govchat.policyscanner.model.ScraperConfig;
import com.govchat.policyscanner.model.ScraperStats;
import com.govchat.policyscanner.scraper.validation.ValidationException;
import com.govchat.policyscanner.scraper.validation.Validators;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Shared plumbing for plugins: configuration checks at construction,
 * statistics, and the {@link #scrape} wrapper that turns discovery failures
 * into a {@link ScrapeResult}.
 *
 * Subclasses implement {@link #discover}, which reports into a
 * {@link DiscoveryProgress} instead of returning a list.
 */
@Slf4j
public abstract class AbstractScraperPlugin implements ScraperPlugin {

    protected final ScraperConfig config;
    private volatile ScraperStats stats = new ScraperStats();

    protected AbstractScraperPlugin(ScraperConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        if (!validateConfig()) {
            throw new ValidationException("Invalid configuration for " + getClass().getSimpleName());
        }
        log.info("Initialized {} with base_url={}", getClass().getSimpleName(), config.getBaseUrl());
    }

    protected abstract void discover(DiscoveryRequest request, DiscoveryProgress progress)
            throws IOException, InterruptedException;

    @Override
    public ScraperConfig getConfig() {
        return config;
    }

    @Override
    public List<DocumentMetadata> discoverDocuments(DiscoveryRequest request) throws IOException, InterruptedException {
        DiscoveryProgress progress = new DiscoveryProgress();
        discover(request, progress);
        return progress.getDocuments();
    }

    @Override
    public ScrapeResult scrape(DiscoveryRequest request) {
        long started = System.nanoTime();
        DiscoveryProgress progress = new DiscoveryProgress();
        DiscoveryRequest effective = request != null ? request : DiscoveryRequest.all();

        log.info("Starting scrape: start_date={}, end_date={}, max_pages={}",
                effective.startDate(), effective.endDate(), effective.maxPages());
        try {
            discover(effective, progress);
            log.info("Discovered {} documents", progress.getDocuments().size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scrape interrupted after {} documents", progress.getDocuments().size());
            progress.addError("Scraping interrupted");
        } catch (Exception e) {
            String message = "Scraping failed: " + e.getMessage();
            log.error(message, e);
            progress.addError(message);
        }

        double durationSeconds = (System.nanoTime() - started) / 1_000_000_000.0;
        return ScrapeResult.of(progress.getDocuments(), progress.getPagesScraped(),
                durationSeconds, progress.getErrors());
    }

    @Override
    public ScraperStats getStats() {
        return stats;
    }

    @Override
    public void resetStats() {
        stats = new ScraperStats();
        log.debug("Statistics reset");
    }

    @Override
    public boolean testConnection() {
        try {
            DiscoveryProgress progress = new DiscoveryProgress();
            discover(DiscoveryRequest.firstPages(1), progress);
            if (progress.hasErrors()) {
                log.error("Connection test failed: {}", progress.getErrors());
                return false;
            }
            log.info("Connection test successful");
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.error("Connection test failed: {}", e.getMessage(), e);
            return false;
        }
    }

    /**
     * Checks the settings every plugin shares. {@link ScraperConfig} already
     * enforces tighter bounds; this guards configs built some other way.
     */
    protected boolean validateBaseConfig() {
        try {
            Validators.validateUrl(config.getBaseUrl());
        } catch (ValidationException e) {
            throw new ValidationException("Invalid base_url: " + e.getMessage(), e);
        }
        try {
            Validators.validateRateLimit(config.getRateLimit());
        } catch (ValidationException e) {
            throw new ValidationException("Invalid rate_limit: " + e.getMessage(), e);
        }
        if (config.getCrawlDelay() < 0) {
            throw new ValidationException("crawl_delay cannot be negative");
        }
        if (config.getTimeout() < 1) {
            throw new ValidationException("timeout must be at least 1 second");
        }
        if (config.getMaxRetries() < 0) {
            throw new ValidationException("max_retries cannot be negative");
        }
        return true;
    }
}
