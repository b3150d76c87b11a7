package com.govchat.policyscanner.indexing;

import com.govchat.policyscanner.search.IndexStats;

import java.util.Map;

/**
 * @param database       stored documents per status value
 * @param totalDocuments stored documents in total
 * @param index          the search index's own view
 */
public record IndexingStatus(Map<String, Long> database, long totalDocuments, IndexStats index) {
}
