package com.govchat.policyscanner.indexing;

import com.govchat.policyscanner.model.DocumentStatus;
import lombok.Builder;

/**
 * Selection for one indexing run.
 *
 * @param sourceId     only documents of this source; null for all
 * @param statusFilter status to pick up, pending by default
 * @param forceReindex reprocess regardless of status (archived stays excluded
 *                     unless it is the requested status)
 * @param maxDocuments cap on candidates; null for no cap
 */
@Builder
public record IndexingRequest(
        String sourceId,
        DocumentStatus statusFilter,
        boolean forceReindex,
        Integer maxDocuments) {

    public IndexingRequest {
        statusFilter = statusFilter == null ? DocumentStatus.PENDING : statusFilter;
    }

    public static IndexingRequest pending() {
        return IndexingRequest.builder().build();
    }
}
