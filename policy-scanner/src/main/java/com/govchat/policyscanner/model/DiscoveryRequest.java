package com.govchat.policyscanner.model;

import lombok.Builder;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;

/**
 * Parameters for one discovery run.
 *
 * @param startDate   only documents published on or after this date
 * @param endDate     only documents published up to this date
 * @param maxPages    page cap, null for no cap
 * @param params      source specific parameters (e.g. municipality, query)
 * @param maxDuration overall deadline for the run, checked between pages; null for none
 */
@Builder
public record DiscoveryRequest(
        LocalDate startDate,
        LocalDate endDate,
        Integer maxPages,
        Map<String, String> params,
        Duration maxDuration) {

    public DiscoveryRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static DiscoveryRequest all() {
        return DiscoveryRequest.builder().build();
    }

    public static DiscoveryRequest firstPages(int maxPages) {
        return DiscoveryRequest.builder().maxPages(maxPages).build();
    }
}
