package com.govchat.policyscanner.search;

import java.util.Map;

public record IndexStats(long numberOfDocuments, boolean indexing, Map<String, Long> fieldDistribution) {

    public static IndexStats empty() {
        return new IndexStats(0, false, Map.of());
    }
}
