package com.govchat.policyscanner.scraper;

import com.govchat.policyscanner.model.DiscoveryRequest;
import com.govchat.policyscanner.model.DocumentMetadata;
import com.govchat.policyscanner.model.ScrapeResult;
import com.govchat.policyscanner.model.ScraperConfig;
import com.govchat.policyscanner.model.ScraperStats;
import com.govchat.policyscanner.scraper.validation.ValidationException;

import java.io.IOException;
import java.util.List;

/**
 * One source site. Implementations discover document metadata by paging
 * through the site's listings and download the documents they found.
 *
 * An instance owns its rate limiter, robots.txt cache and statistics, and
 * serves one run at a time.
 */
public interface ScraperPlugin {

    ScraperConfig getConfig();

    /**
     * Checks shared settings and the plugin's own requirements (selectors,
     * parameters).
     *
     * @return true when the configuration is usable
     * @throws ValidationException describing the first problem found
     */
    boolean validateConfig();

    /**
     * Pages through the source and returns every document found, in page order.
     */
    List<DocumentMetadata> discoverDocuments(DiscoveryRequest request) throws IOException, InterruptedException;

    /**
     * Fetches the document body.
     *
     * @throws IOException on transport failure or a non-2xx answer
     */
    byte[] downloadDocument(DocumentMetadata metadata) throws IOException, InterruptedException;

    /**
     * Runs discovery with timing and failure isolation. Never throws: failures
     * come back as a result with {@code success=false} and the documents
     * gathered before the failure.
     */
    ScrapeResult scrape(DiscoveryRequest request);

    ScraperStats getStats();

    void resetStats();

    /** Tries to discover a single page. */
    boolean testConnection();
}
