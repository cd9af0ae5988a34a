package com.tapas.sitestats.stats.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Aggregate stats row. {@code totaltime} is in seconds.
 * {@code conversions} is only produced by the relational backend and is left
 * out of the JSON when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebsiteStats(
        long pageviews,
        long visitors,
        long visits,
        long bounces,
        long totaltime,
        Long conversions) {
}
