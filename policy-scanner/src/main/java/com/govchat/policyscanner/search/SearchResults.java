package com.govchat.policyscanner.search;

import java.util.List;
import java.util.Map;

public record SearchResults(
        List<Map<String, Object>> hits,
        long estimatedTotalHits,
        Map<String, Map<String, Long>> facetDistribution,
        long processingTimeMs,
        String query,
        int page,
        int limit) {
}
