package com.govchat.policyscanner.search;

import java.util.List;
import java.util.Map;

/**
 * Full-text search index holding one entry per indexed policy document.
 *
 * Document writes are batch operations: they report success or failure for
 * the whole batch, never per item.
 */
public interface SearchIndex {

    /**
     * Verifies the index server is reachable.
     *
     * @throws SearchIndexException when it is not
     */
    void connect();

    boolean isHealthy();

    /** Creates the index if needed and applies {@code settings}. */
    void createIndex(IndexSettings settings);

    boolean deleteIndex();

    boolean addDocuments(List<Map<String, Object>> documents);

    boolean updateDocuments(List<Map<String, Object>> documents);

    boolean deleteDocuments(List<String> ids);

    /** Removes every document, keeping the index and its settings. */
    boolean clear();

    SearchResults search(SearchQuery query);

    /** Document count and indexing flag; {@link IndexStats#empty()} when unavailable. */
    IndexStats getStats();
}
