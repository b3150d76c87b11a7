package com.govchat.policyscanner.search;

import lombok.Builder;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured search filters, rendered to the index's filter grammar:
 * OR within municipality and within category, AND across fields, and a
 * closed range on {@code publication_timestamp} (epoch seconds, UTC).
 */
@Builder
public record SearchFilters(
        List<String> municipalities,
        List<String> categories,
        String documentType,
        String sourceId,
        LocalDate dateFrom,
        LocalDate dateTo) {

    public SearchFilters {
        municipalities = municipalities == null ? List.of() : List.copyOf(municipalities);
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    /** The filter expression, or null when no filter is set. */
    public String toFilterExpression() {
        List<String> parts = new ArrayList<>();

        anyOf("municipality", municipalities, parts);
        anyOf("category", categories, parts);
        if (documentType != null && !documentType.isBlank()) {
            parts.add(equalTo("document_type", documentType));
        }
        if (sourceId != null && !sourceId.isBlank()) {
            parts.add(equalTo("source_id", sourceId));
        }

        List<String> range = new ArrayList<>();
        if (dateFrom != null) {
            range.add("publication_timestamp >= " + epochSeconds(dateFrom));
        }
        if (dateTo != null) {
            range.add("publication_timestamp <= " + epochSeconds(dateTo));
        }
        if (!range.isEmpty()) {
            parts.add("(" + String.join(" AND ", range) + ")");
        }

        return parts.isEmpty() ? null : String.join(" AND ", parts);
    }

    public static long epochSeconds(LocalDate date) {
        return date.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
    }

    private static void anyOf(String field, List<String> values, List<String> parts) {
        List<String> terms = values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(value -> equalTo(field, value))
                .toList();
        if (!terms.isEmpty()) {
            parts.add("(" + String.join(" OR ", terms) + ")");
        }
    }

    private static String equalTo(String field, String value) {
        return field + " = '" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
