package com.govchat.policyscanner.indexing;

import com.govchat.policyscanner.config.PolicyScannerProperties;
import com.govchat.policyscanner.model.DocumentStatus;
import com.govchat.policyscanner.model.IndexingStats;
import com.govchat.policyscanner.model.PolicyDocument;
import com.govchat.policyscanner.processing.DocumentProcessor;
import com.govchat.policyscanner.processing.ProcessedDocument;
import com.govchat.policyscanner.processing.ProcessingException;
import com.govchat.policyscanner.search.IndexStats;
import com.govchat.policyscanner.search.SearchFilters;
import com.govchat.policyscanner.search.SearchIndex;
import com.govchat.policyscanner.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Moves stored documents into the search index.
 *
 * Candidates are processed in batches. Within a batch each document is
 * extracted on its own and a failure only fails that document. The documents
 * that made it are then sent to the index in a single call; if that call
 * fails, every document of the batch is marked failed.
 *
 * A document whose text hashes to the same value as an already stored
 * document (or an earlier one in the batch) is archived as a duplicate and
 * counted as skipped. {@code processed == indexed + failed} holds for every run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IndexingService {

    private final SearchIndex searchIndex;
    private final DocumentStore documentStore;
    private final DocumentProcessor processor;
    private final PolicyScannerProperties properties;

    private record PreparedDocument(String id, String contentHash, Integer pageCount, Map<String, Object> entry) {
    }

    /**
     * Runs one indexing pass.
     *
     * @throws com.govchat.policyscanner.search.SearchIndexException when the index is unreachable
     */
    public IndexingStats run(IndexingRequest request) {
        IndexingStats stats = new IndexingStats();
        searchIndex.connect();

        Set<DocumentStatus> statuses = candidateStatuses(request);
        log.info("Fetching documents: source_id={}, statuses={}, force_reindex={}",
                request.sourceId(), statuses, request.forceReindex());
        List<PolicyDocument> documents = documentStore.findDocuments(request.sourceId(), statuses, request.maxDocuments());
        stats.setTotalDocuments(documents.size());
        log.info("Found {} documents to index", documents.size());

        int batchSize = Math.max(1, properties.getIndexing().getBatchSize());
        int totalBatches = (documents.size() + batchSize - 1) / batchSize;
        for (int offset = 0; offset < documents.size(); offset += batchSize) {
            List<PolicyDocument> batch = documents.subList(offset, Math.min(offset + batchSize, documents.size()));
            log.info("Processing batch {}/{} ({} documents)", offset / batchSize + 1, totalBatches, batch.size());
            processBatch(batch, stats, request.forceReindex());
        }

        stats.finish();
        log.info("Indexing complete: {} indexed, {} failed, {} skipped in {}s",
                stats.getIndexed(), stats.getFailed(), stats.getSkipped(),
                String.format("%.2f", stats.getDurationSeconds()));
        return stats;
    }

    /**
     * Reprocesses and resubmits one document.
     *
     * @return false when the document is missing, archived, a duplicate, or
     * anything fails; never throws
     */
    public boolean reindexDocument(String documentId) {
        try {
            Optional<PolicyDocument> found = documentStore.findById(documentId);
            if (found.isEmpty()) {
                log.error("Document not found: {}", documentId);
                return false;
            }
            PolicyDocument document = found.get();
            if (document.getStatus() == DocumentStatus.ARCHIVED) {
                log.warn("Document {} is archived and will not be reindexed", documentId);
                return false;
            }

            searchIndex.connect();
            documentStore.updateStatus(documentId, DocumentStatus.PROCESSING);
            try {
                ProcessedDocument processed = processor.process(resolveFile(document), document.getDocumentType());
                Optional<String> duplicateOf = findDuplicate(document, processed.contentHash(), Map.of());
                if (duplicateOf.isPresent()) {
                    documentStore.markArchivedDuplicate(documentId, duplicateOf.get());
                    log.info("Document {} duplicates {}, archived", documentId, duplicateOf.get());
                    return false;
                }
                if (!searchIndex.addDocuments(List.of(toIndexEntry(document, processed)))) {
                    markFailed(documentId, "Indexing failed: search index rejected the document");
                    return false;
                }
                documentStore.markIndexed(documentId, LocalDateTime.now(), processed.contentHash(), processed.pageCount());
            } catch (RuntimeException e) {
                markFailed(documentId, "Reindex failed: " + e.getMessage());
                throw e;
            }
            log.info("Successfully reindexed document {}", documentId);
            return true;
        } catch (Exception e) {
            log.error("Failed to reindex document {}: {}", documentId, e.getMessage());
            return false;
        }
    }

    /**
     * Removes documents from the index and puts them back to pending. They
     * stay in the document store.
     */
    public boolean deleteFromIndex(List<String> documentIds) {
        try {
            searchIndex.connect();
            if (!searchIndex.deleteDocuments(documentIds)) {
                log.error("Search index rejected deletion of {} documents", documentIds.size());
                return false;
            }
            documentIds.forEach(id -> documentStore.updateStatus(id, DocumentStatus.PENDING));
            log.info("Deleted {} documents from index", documentIds.size());
            return true;
        } catch (Exception e) {
            log.error("Failed to delete documents from index: {}", e.getMessage());
            return false;
        }
    }

    public IndexingStatus status() {
        Map<String, Long> counts = new LinkedHashMap<>();
        documentStore.countByStatus().forEach((status, count) -> counts.put(status.value(), count));
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        IndexStats indexStats = searchIndex.getStats();
        return new IndexingStatus(counts, total, indexStats);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void processBatch(List<PolicyDocument> batch, IndexingStats stats, boolean forceReindex) {
        List<PreparedDocument> prepared = new ArrayList<>();
        Map<String, String> batchHashes = new HashMap<>();

        for (PolicyDocument document : batch) {
            String id = document.getId();
            if (document.getStatus() == DocumentStatus.INDEXED && !forceReindex) {
                log.debug("Skipping already indexed document: {}", id);
                stats.recordSkip();
                continue;
            }
            try {
                documentStore.updateStatus(id, DocumentStatus.PROCESSING);
                log.debug("Processing document {}: {}", id, document.getTitle());
                ProcessedDocument processed = processor.process(resolveFile(document), document.getDocumentType());

                Optional<String> duplicateOf = findDuplicate(document, processed.contentHash(), batchHashes);
                if (duplicateOf.isPresent()) {
                    log.info("Document {} has the same text as {}, archiving", id, duplicateOf.get());
                    documentStore.markArchivedDuplicate(id, duplicateOf.get());
                    stats.recordSkip();
                    continue;
                }

                batchHashes.put(processed.contentHash(), id);
                prepared.add(new PreparedDocument(id, processed.contentHash(), processed.pageCount(),
                        toIndexEntry(document, processed)));
            } catch (Exception e) {
                String error = "Processing failed: " + e.getMessage();
                log.error("Document {} failed: {}", id, error);
                stats.recordFailure(id, error);
                markFailed(id, error);
            }
        }

        if (prepared.isEmpty()) {
            return;
        }

        String failure = submit(prepared);
        if (failure == null) {
            LocalDateTime indexedAt = LocalDateTime.now();
            for (PreparedDocument document : prepared) {
                try {
                    documentStore.markIndexed(document.id(), indexedAt, document.contentHash(), document.pageCount());
                    stats.recordSuccess();
                } catch (RuntimeException e) {
                    String error = "Status update failed: " + e.getMessage();
                    log.error("Document {} indexed but not marked: {}", document.id(), e.getMessage());
                    stats.recordFailure(document.id(), error);
                    markFailed(document.id(), error);
                }
            }
            log.info("Successfully indexed {} documents", prepared.size());
        } else {
            for (PreparedDocument document : prepared) {
                stats.recordFailure(document.id(), failure);
                markFailed(document.id(), failure);
            }
        }
    }

    /** Returns null on success, otherwise the failure recorded for every document. */
    private String submit(List<PreparedDocument> prepared) {
        log.info("Indexing {} documents to search index", prepared.size());
        try {
            boolean accepted = searchIndex.addDocuments(prepared.stream().map(PreparedDocument::entry).toList());
            return accepted ? null : "Indexing failed: search index rejected the batch";
        } catch (RuntimeException e) {
            log.error("Bulk indexing failed: {}", e.getMessage());
            return "Indexing failed: " + e.getMessage();
        }
    }

    private Optional<String> findDuplicate(PolicyDocument document, String contentHash, Map<String, String> batchHashes) {
        String inBatch = batchHashes.get(contentHash);
        if (inBatch != null) {
            return Optional.of(inBatch);
        }
        return documentStore.findByContentHash(contentHash)
                .map(PolicyDocument::getId)
                .filter(otherId -> !otherId.equals(document.getId()));
    }

    private Set<DocumentStatus> candidateStatuses(IndexingRequest request) {
        if (!request.forceReindex() || request.statusFilter() == DocumentStatus.ARCHIVED) {
            return EnumSet.of(request.statusFilter());
        }
        return EnumSet.complementOf(EnumSet.of(DocumentStatus.ARCHIVED));
    }

    /**
     * {@code metadata.file_path} when present, otherwise
     * {@code {storagePath}/{sourceId}/{id}.{type}}.
     */
    Path resolveFile(PolicyDocument document) {
        Object explicit = document.getMetadata() != null ? document.getMetadata().get(PolicyDocument.META_FILE_PATH) : null;
        if (explicit != null && !explicit.toString().isBlank()) {
            return Path.of(explicit.toString());
        }
        if (document.getDocumentType() == null) {
            throw new ProcessingException("Could not determine file path for document " + document.getId());
        }
        return Path.of(properties.getStoragePath(), document.getSourceId(),
                document.getId() + "." + document.getDocumentType().value());
    }

    private Map<String, Object> toIndexEntry(PolicyDocument document, ProcessedDocument processed) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("id", document.getId());
        entry.put("title", document.getTitle());
        entry.put("content", processed.text());
        entry.put("description", document.getDescription() != null ? document.getDescription() : processed.summary());
        entry.put("municipality", document.getMunicipality() != null ? document.getMunicipality() : "");
        entry.put("publication_date", document.getPublicationDate() != null ? document.getPublicationDate().toString() : "");
        if (document.getPublicationDate() != null) {
            entry.put("publication_timestamp", SearchFilters.epochSeconds(document.getPublicationDate()));
        }
        entry.put("document_type", document.getDocumentType() != null ? document.getDocumentType().value() : "");
        entry.put("document_url", document.getDocumentUrl());
        entry.put("source_id", document.getSourceId());
        entry.put("status", DocumentStatus.INDEXED.value());
        entry.put("word_count", processed.wordCount());
        entry.put("page_count", processed.pageCount() != null ? processed.pageCount() : 0);
        entry.put("chunk_count", processed.chunkCount());
        Object category = document.getMetadata() != null ? document.getMetadata().get(PolicyDocument.META_CATEGORY) : null;
        if (category != null) {
            entry.put("category", category);
        }
        return entry;
    }

    private void markFailed(String documentId, String error) {
        try {
            documentStore.markFailed(documentId, error);
        } catch (RuntimeException e) {
            log.error("Could not record failure for document {}: {}", documentId, e.getMessage(), e);
        }
    }
}
