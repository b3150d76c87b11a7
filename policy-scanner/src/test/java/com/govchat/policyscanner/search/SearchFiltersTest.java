package com.govchat.policyscanner.search;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SearchFiltersTest {

    @Test
    void toFilterExpression_EmptyFilters_IsNull() {
        assertNull(SearchFilters.builder().build().toFilterExpression());
        assertNull(SearchFilters.builder().municipalities(List.of(" ")).build().toFilterExpression());
    }

    @Test
    void toFilterExpression_OrWithinFieldAndAcrossFields() {
        // Given
        SearchFilters filters = SearchFilters.builder()
                .municipalities(List.of("Utrecht", "Den Haag"))
                .categories(List.of("verordening"))
                .documentType("pdf")
                .build();

        // When
        String expression = filters.toFilterExpression();

        // Then
        assertEquals("(municipality = 'Utrecht' OR municipality = 'Den Haag')"
                + " AND (category = 'verordening')"
                + " AND document_type = 'pdf'", expression);
    }

    @Test
    void toFilterExpression_DateRangeUsesEpochSeconds() {
        // Given
        SearchFilters filters = SearchFilters.builder()
                .dateFrom(LocalDate.of(2024, 1, 1))
                .dateTo(LocalDate.of(2024, 1, 31))
                .build();

        // When
        String expression = filters.toFilterExpression();

        // Then
        assertEquals("(publication_timestamp >= 1704067200 AND publication_timestamp <= 1706659200)", expression);
    }

    @Test
    void toFilterExpression_EscapesQuotes() {
        SearchFilters filters = SearchFilters.builder().sourceId("gemeente's-hertogenbosch").build();

        assertEquals("source_id = 'gemeente\\'s-hertogenbosch'", filters.toFilterExpression());
    }

    @Test
    void searchQuery_DefaultsAndOffset() {
        SearchQuery query = SearchQuery.builder().page(3).limit(25).build();

        assertEquals("", query.query());
        assertEquals(50, query.offset());
        assertEquals(SearchQuery.DEFAULT_FACETS, query.facets());
        assertEquals(0, SearchQuery.builder().page(0).build().offset());
    }
}
