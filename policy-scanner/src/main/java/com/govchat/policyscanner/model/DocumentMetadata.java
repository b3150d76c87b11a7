package com.govchat.policyscanner.model;

import com.govchat.policyscanner.scraper.validation.ValidationException;
import com.govchat.policyscanner.scraper.validation.Validators;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/**
 * A document found during discovery, before anything has been downloaded.
 *
 * Values are checked when the object is built: a blank or over-long title,
 * a non-http(s) URL, an empty external id or a negative file size fail with
 * {@link ValidationException}.
 */
@Value
public class DocumentMetadata {

    public static final int MAX_TITLE_LENGTH = 1000;

    String title;
    String url;
    String externalId;
    LocalDate publicationDate;
    LocalDate effectiveDate;
    String municipality;
    DocumentType documentType;
    String description;
    Long fileSize;
    Map<String, Object> metadata;

    @Builder(toBuilder = true)
    private DocumentMetadata(String title,
                             String url,
                             String externalId,
                             LocalDate publicationDate,
                             LocalDate effectiveDate,
                             String municipality,
                             DocumentType documentType,
                             String description,
                             Long fileSize,
                             Map<String, Object> metadata) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("title cannot be empty");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new ValidationException("title cannot exceed " + MAX_TITLE_LENGTH + " characters");
        }
        Validators.validateUrl(url);
        if (fileSize != null && fileSize < 0) {
            throw new ValidationException("file_size cannot be negative: " + fileSize);
        }

        this.title = title;
        this.url = url;
        this.externalId = Validators.validateExternalId(externalId);
        this.publicationDate = publicationDate;
        this.effectiveDate = effectiveDate;
        this.municipality = Validators.normalizeMunicipality(municipality);
        this.documentType = documentType != null ? documentType : DocumentType.UNKNOWN;
        this.description = description;
        this.fileSize = fileSize;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
