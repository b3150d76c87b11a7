package com.govchat.policyscanner.store;

import com.govchat.policyscanner.model.DocumentStatus;
import com.govchat.policyscanner.model.PolicyDocument;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence for policy documents and their lifecycle status.
 */
public interface DocumentStore {

    /** Creates the backing tables when they do not exist yet. */
    void ensureSchema();

    Optional<PolicyDocument> findById(String id);

    /**
     * Documents in insertion order.
     *
     * @param sourceId null for every source
     * @param statuses empty for every status
     * @param limit    null for no limit
     */
    List<PolicyDocument> findDocuments(String sourceId, Set<DocumentStatus> statuses, Integer limit);

    Optional<PolicyDocument> findByContentHash(String contentHash);

    Optional<PolicyDocument> findByExternalId(String sourceId, String externalId);

    /**
     * Stores a new document; id and timestamps are filled in when missing.
     *
     * @throws DuplicateDocumentException when the content hash or the
     *                                    (source, external id) pair is taken
     */
    PolicyDocument insert(PolicyDocument document);

    void updateStatus(String id, DocumentStatus status);

    /** Sets status failed and keeps the error message in metadata. */
    void markFailed(String id, String error);

    /** Sets status indexed, records when, and replaces the hash with the text hash. */
    void markIndexed(String id, LocalDateTime indexedAt, String contentHash, Integer pageCount);

    /** Sets status archived and records which document holds the same text. */
    void markArchivedDuplicate(String id, String duplicateOfId);

    Map<DocumentStatus, Long> countByStatus();
}
