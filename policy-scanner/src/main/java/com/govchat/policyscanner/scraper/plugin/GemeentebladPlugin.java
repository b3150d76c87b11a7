package com.govchat.policyscanner.scraper.plugin;

import com.govchat.policyscanner.model.DiscoveryRequest;
import com.govchat.policyscanner.model.DocumentMetadata;
import com.govchat.policyscanner.model.PolicyDocument;
import com.govchat.policyscanner.model.ScraperConfig;
import com.govchat.policyscanner.scraper.BaseScraper;
import com.govchat.policyscanner.scraper.middleware.BotDetectionHandler;
import com.govchat.policyscanner.scraper.validation.ValidationException;
import com.govchat.policyscanner.scraper.validation.Validators;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.http.HttpClient;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Scraper for gemeenteblad.nl, the portal where Dutch municipalities publish
 * official announcements and regulations.
 *
 * Selectors (jsoup CSS syntax):
 * <ul>
 *   <li>{@code item}: one search result</li>
 *   <li>{@code title}, {@code url}, {@code date}: inside an item, required</li>
 *   <li>{@code municipality}, {@code description}: inside an item, optional</li>
 *   <li>{@code type}: optional; its text becomes the document's category</li>
 * </ul>
 *
 * Request parameters {@code municipality} and {@code query} narrow the search.
 */
@Slf4j
public class GemeentebladPlugin extends BaseScraper {

    public static final String NAME = "gemeenteblad";
    public static final List<String> REQUIRED_SELECTORS = List.of("item", "title", "url", "date");

    public GemeentebladPlugin(ScraperConfig config) {
        super(config);
    }

    public GemeentebladPlugin(ScraperConfig config, HttpClient httpClient, BotDetectionHandler botHandler) {
        super(config, httpClient, botHandler);
    }

    @Override
    public boolean validateConfig() {
        validateBaseConfig();

        List<String> missing = REQUIRED_SELECTORS.stream()
                .filter(name -> !config.getSelectors().containsKey(name))
                .toList();
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing required selectors: " + missing
                    + ". Required: " + REQUIRED_SELECTORS);
        }
        config.getSelectors().values().forEach(Validators::validateCssSelector);
        return true;
    }

    /**
     * {@code {base}/search?page=N&from_date=..&to_date=..&municipality=..&q=..}
     * followed by the configured custom parameters in key order. Page 1 has no
     * page parameter; values are URL-encoded.
     */
    @Override
    protected String buildSearchUrl(int page, DiscoveryRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl() + "/search");
        if (page > 1) {
            builder.queryParam("page", page);
        }
        if (request.startDate() != null) {
            builder.queryParam("from_date", request.startDate().toString());
        }
        if (request.endDate() != null) {
            builder.queryParam("to_date", request.endDate().toString());
        }
        String municipality = request.params().get("municipality");
        if (municipality != null && !municipality.isBlank()) {
            builder.queryParam("municipality", municipality);
        }
        String query = request.params().get("query");
        if (query != null && !query.isBlank()) {
            builder.queryParam("q", query);
        }
        new TreeMap<>(config.getCustomParams()).forEach((key, value) -> builder.queryParam(key, value));

        return builder.encode().toUriString();
    }

    @Override
    protected List<DocumentMetadata> parseSearchResults(String html) {
        Map<String, String> selectors = config.getSelectors();
        Document page = Jsoup.parse(html, config.getBaseUrl());
        Elements items = page.select(selectors.get("item"));
        log.debug("Found {} items with selector '{}'", items.size(), selectors.get("item"));

        List<DocumentMetadata> documents = new ArrayList<>();
        for (Element item : items) {
            try {
                Optional<DocumentMetadata> document = parseItem(item, selectors);
                if (document.isPresent()) {
                    documents.add(document.get());
                    getStats().recordDocumentDiscovered();
                }
            } catch (RuntimeException e) {
                log.warn("Failed to parse document item: {}", e.getMessage());
            }
        }
        return documents;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<DocumentMetadata> parseItem(Element item, Map<String, String> selectors) {
        Element titleElement = item.selectFirst(selectors.get("title"));
        if (titleElement == null || titleElement.text().isBlank()) {
            log.debug("Title element not found");
            return Optional.empty();
        }

        Element urlElement = item.selectFirst(selectors.get("url"));
        String href = urlElement != null ? urlElement.attr("href") : "";
        if (href.isBlank()) {
            log.debug("URL element not found for '{}'", titleElement.text());
            return Optional.empty();
        }
        String url = Validators.normalizeUrl(href, config.getBaseUrl());

        LocalDate publicationDate = null;
        Element dateElement = item.selectFirst(selectors.get("date"));
        if (dateElement != null) {
            try {
                publicationDate = Validators.parseDate(dateElement.text());
            } catch (ValidationException e) {
                log.debug("Failed to parse date '{}': {}", dateElement.text(), e.getMessage());
            }
        }

        String municipality = optionalText(item, selectors.get("municipality"));
        String description = optionalText(item, selectors.get("description"));
        String category = optionalText(item, selectors.get("type"));

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("source", NAME);
        extra.put("scraped_at", LocalDateTime.now().toString());
        if (category != null && !category.isBlank()) {
            extra.put(PolicyDocument.META_CATEGORY, category.trim());
        }

        return Optional.of(DocumentMetadata.builder()
                .title(titleElement.text())
                .url(url)
                .externalId(Validators.externalIdFromUrl(url))
                .publicationDate(publicationDate)
                .municipality(Validators.normalizeMunicipality(municipality))
                .documentType(Validators.documentTypeOf(url))
                .description(description)
                .metadata(extra)
                .build());
    }

    private static String optionalText(Element item, String selector) {
        if (selector == null) {
            return null;
        }
        Element element = item.selectFirst(selector);
        return element != null ? element.text() : null;
    }
}
