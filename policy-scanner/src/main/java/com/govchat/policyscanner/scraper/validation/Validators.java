package com.govchat.policyscanner.scraper.validation;

import com.govchat.policyscanner.model.DocumentType;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * URL, date, identifier and filename normalisation plus the hashing
 * primitives shared by discovery, ingestion and indexing.
 */
public final class Validators {

    public static final int MAX_EXTERNAL_ID_LENGTH = 500;
    public static final int MAX_MUNICIPALITY_LENGTH = 255;
    public static final int MIN_RATE_LIMIT = 1;
    public static final int MAX_RATE_LIMIT = 100;

    private static final Set<String> ALLOWED_SCHEMES = Set.of("http", "https");
    private static final int EXTERNAL_ID_HASH_LENGTH = 32;

    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern DASHED_DATE = Pattern.compile("^\\d{2}-\\d{2}-\\d{4}$");
    private static final Pattern SLASHED_DATE = Pattern.compile("^\\d{2}/\\d{2}/\\d{4}$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[^a-zA-Z0-9._-]");

    private Validators() {
    }

    // ── URLs ─────────────────────────────────────────────────────────────────

    /**
     * Checks that the value is an absolute http(s) URL with a host.
     *
     * @throws ValidationException if it is not
     */
    public static void validateUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("URL must be a non-empty string");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new ValidationException("Invalid URL format: " + e.getMessage(), e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!ALLOWED_SCHEMES.contains(scheme)) {
            throw new ValidationException("URL scheme '" + scheme + "' not allowed. Allowed schemes: " + ALLOWED_SCHEMES);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new ValidationException("URL must have a valid domain: " + url);
        }
    }

    /**
     * Resolves a possibly relative link against the base URL. Absolute http(s)
     * links are returned unchanged; protocol-relative links take the base scheme.
     */
    public static String normalizeUrl(String url, String baseUrl) {
        String trimmed = url.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return trimmed;
        }
        URI base = URI.create(baseUrl);
        if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
            base = URI.create(baseUrl + "/");
        }
        if (trimmed.startsWith("//")) {
            return base.getScheme() + ":" + trimmed;
        }
        try {
            return base.resolve(new URI(trimmed.replace(" ", "%20"))).toString();
        } catch (URISyntaxException e) {
            throw new ValidationException("Cannot resolve link '" + url + "' against " + baseUrl, e);
        }
    }

    // ── Identifiers & hashes ─────────────────────────────────────────────────

    public static String validateExternalId(String externalId) {
        if (externalId == null || externalId.isBlank()) {
            throw new ValidationException("external_id cannot be empty");
        }
        String trimmed = externalId.trim();
        if (trimmed.length() > MAX_EXTERNAL_ID_LENGTH) {
            throw new ValidationException("external_id cannot exceed " + MAX_EXTERNAL_ID_LENGTH + " characters");
        }
        return trimmed;
    }

    /** First 32 lowercase hex characters of SHA-256 over the absolute URL. */
    public static String externalIdFromUrl(String absoluteUrl) {
        return sha256Hex(absoluteUrl.getBytes(StandardCharsets.UTF_8)).substring(0, EXTERNAL_ID_HASH_LENGTH);
    }

    /** Dedup key: 64 lowercase hex characters of SHA-256 over the UTF-8 text. */
    public static String contentHash(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String contentHash(byte[] content) {
        return sha256Hex(content);
    }

    private static String sha256Hex(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ── Dates ────────────────────────────────────────────────────────────────

    /**
     * Parses YYYY-MM-DD, DD-MM-YYYY or DD/MM/YYYY. Blank input gives null.
     *
     * @throws ValidationException on any other format or an impossible date
     */
    public static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            if (ISO_DATE.matcher(text).matches()) {
                return LocalDate.parse(text);
            }
            if (DASHED_DATE.matcher(text).matches()) {
                String[] parts = text.split("-");
                return LocalDate.of(Integer.parseInt(parts[2]), Integer.parseInt(parts[1]), Integer.parseInt(parts[0]));
            }
            if (SLASHED_DATE.matcher(text).matches()) {
                String[] parts = text.split("/");
                return LocalDate.of(Integer.parseInt(parts[2]), Integer.parseInt(parts[1]), Integer.parseInt(parts[0]));
            }
        } catch (DateTimeException e) {
            throw new ValidationException("Invalid date: " + text + " - " + e.getMessage(), e);
        }
        throw new ValidationException("Invalid date format: " + text + ". Expected YYYY-MM-DD, DD-MM-YYYY, or DD/MM/YYYY");
    }

    // ── Text fields ──────────────────────────────────────────────────────────

    /** Trims and collapses internal whitespace; blank gives null. */
    public static String normalizeMunicipality(String municipality) {
        if (municipality == null || municipality.isBlank()) {
            return null;
        }
        String normalised = WHITESPACE.matcher(municipality.trim()).replaceAll(" ");
        if (normalised.length() > MAX_MUNICIPALITY_LENGTH) {
            throw new ValidationException("Municipality name cannot exceed " + MAX_MUNICIPALITY_LENGTH + " characters");
        }
        return normalised;
    }

    /** Infers the document type from a filename or URL extension. */
    public static DocumentType documentTypeOf(String filename) {
        if (filename == null || filename.isBlank()) {
            return DocumentType.UNKNOWN;
        }
        String path = filename.toLowerCase(Locale.ROOT);
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        if (path.endsWith(".pdf")) {
            return DocumentType.PDF;
        }
        if (path.endsWith(".html") || path.endsWith(".htm")) {
            return DocumentType.HTML;
        }
        if (path.endsWith(".docx") || path.endsWith(".doc")) {
            return DocumentType.DOCX;
        }
        if (path.endsWith(".xlsx") || path.endsWith(".xls")) {
            return DocumentType.XLSX;
        }
        return DocumentType.UNKNOWN;
    }

    /**
     * Sniffs downloaded bytes for the formats we can extract. Used when the URL
     * carried no usable extension.
     */
    public static DocumentType detectDocumentType(byte[] content) {
        if (content == null || content.length < 4) {
            return DocumentType.UNKNOWN;
        }
        if (content[0] == '%' && content[1] == 'P' && content[2] == 'D' && content[3] == 'F') {
            return DocumentType.PDF;
        }
        if (content[0] == 'P' && content[1] == 'K' && content[2] == 3 && content[3] == 4) {
            return DocumentType.DOCX;
        }
        String head = new String(content, 0, Math.min(content.length, 1024), StandardCharsets.UTF_8)
                .toLowerCase(Locale.ROOT);
        if (head.contains("<html") || head.contains("<!doctype html")) {
            return DocumentType.HTML;
        }
        return DocumentType.UNKNOWN;
    }

    /** Strips traversal sequences and anything outside [a-zA-Z0-9._-]; caps at 255 chars. */
    public static String sanitizeFilename(String filename) {
        String cleaned = filename
                .replace("..", "")
                .replace('/', '_')
                .replace('\\', '_')
                .replace("\0", "");
        cleaned = UNSAFE_FILENAME_CHARS.matcher(cleaned).replaceAll("_");
        if (cleaned.length() > 255) {
            int dot = cleaned.lastIndexOf('.');
            if (dot > 0) {
                String ext = cleaned.substring(dot + 1);
                cleaned = cleaned.substring(0, Math.min(dot, 250)) + "." + ext;
            } else {
                cleaned = cleaned.substring(0, 250);
            }
        }
        return cleaned;
    }

    /** Parses {@code selector} with jsoup's selector grammar. */
    public static void validateCssSelector(String selector) {
        if (selector == null || selector.isBlank()) {
            throw new ValidationException("CSS selector must be a non-empty string");
        }
        try {
            QueryParser.parse(selector);
        } catch (Selector.SelectorParseException | IllegalArgumentException e) {
            throw new ValidationException("Invalid CSS selector '" + selector + "': " + e.getMessage(), e);
        }
    }

    public static void validateRateLimit(int rateLimit) {
        if (rateLimit < MIN_RATE_LIMIT) {
            throw new ValidationException("Rate limit must be at least 1 request per second");
        }
        if (rateLimit > MAX_RATE_LIMIT) {
            throw new ValidationException("Rate limit cannot exceed 100 requests per second");
        }
    }

    private static int indexOfAny(String text, char a, char b) {
        int ia = text.indexOf(a);
        int ib = text.indexOf(b);
        if (ia < 0) {
            return ib;
        }
        return ib < 0 ? ia : Math.min(ia, ib);
    }
}
