package com.govchat.policyscanner.search;

import lombok.Builder;

import java.util.List;

/**
 * @param query   free text, may be empty
 * @param filters structured filters, may be null
 * @param page    1-based page number
 * @param limit   hits per page
 * @param sort    e.g. {@code publication_timestamp:desc}
 * @param facets  fields to count values for
 */
@Builder
public record SearchQuery(
        String query,
        SearchFilters filters,
        Integer page,
        Integer limit,
        List<String> sort,
        List<String> facets) {

    public static final List<String> DEFAULT_FACETS = List.of("municipality", "category", "document_type");
    public static final int DEFAULT_LIMIT = 20;

    public SearchQuery {
        query = query == null ? "" : query;
        page = page == null || page < 1 ? 1 : page;
        limit = limit == null || limit < 1 ? DEFAULT_LIMIT : limit;
        sort = sort == null ? List.of() : List.copyOf(sort);
        facets = facets == null ? DEFAULT_FACETS : List.copyOf(facets);
    }

    public int offset() {
        return (page - 1) * limit;
    }
}
