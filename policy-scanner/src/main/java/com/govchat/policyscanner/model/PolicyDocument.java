package com.govchat.policyscanner.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * A document row in the document store.
 *
 * Schema notes:
 *  - contentHash is unique and is the dedup key (SHA-256, 64 hex chars).
 *    Ingestion stores the hash of the downloaded bytes; indexing replaces it
 *    with the hash of the extracted text.
 *  - metadata["file_path"] points at the stored original, metadata["error"]
 *    holds the last processing or indexing failure.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PolicyDocument {

    public static final String META_FILE_PATH = "file_path";
    public static final String META_ERROR = "error";
    public static final String META_CATEGORY = "category";
    public static final String META_DUPLICATE_OF = "duplicate_of";

    private String id;
    private String sourceId;
    private String externalId;
    private String title;
    private String description;
    private String contentHash;
    private String documentUrl;
    private DocumentType documentType;
    private String municipality;
    private LocalDate publicationDate;
    private LocalDate effectiveDate;
    private Long fileSize;
    private Integer pageCount;
    @Builder.Default
    private String language = "nl";
    @Builder.Default
    private DocumentStatus status = DocumentStatus.PENDING;
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime indexedAt;
}
