package com.govchat.policyscanner.search;

import java.util.List;

/**
 * Index layout: primary key plus the attribute and ranking configuration.
 */
public record IndexSettings(
        String primaryKey,
        List<String> searchableAttributes,
        List<String> filterableAttributes,
        List<String> sortableAttributes,
        List<String> rankingRules,
        List<String> stopWords) {

    public static final List<String> DUTCH_STOP_WORDS = List.of(
            "de", "het", "een", "en", "van", "op", "in", "te", "voor", "dat",
            "is", "was", "zijn", "als", "met", "aan", "door", "om", "naar");

    public IndexSettings {
        searchableAttributes = List.copyOf(searchableAttributes);
        filterableAttributes = List.copyOf(filterableAttributes);
        sortableAttributes = List.copyOf(sortableAttributes);
        rankingRules = List.copyOf(rankingRules);
        stopWords = List.copyOf(stopWords);
    }

    /** Layout of the policy document index. */
    public static IndexSettings policyDocuments() {
        return new IndexSettings(
                "id",
                List.of("title", "content", "description", "municipality"),
                List.of("municipality", "category", "document_type", "publication_timestamp", "source_id", "status"),
                List.of("publication_timestamp", "title"),
                List.of("words", "typo", "proximity", "attribute", "sort", "exactness"),
                DUTCH_STOP_WORDS);
    }
}
