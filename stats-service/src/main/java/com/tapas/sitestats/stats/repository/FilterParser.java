package com.tapas.sitestats.stats.repository;

import com.tapas.sitestats.stats.domain.QueryFilters;

import java.util.UUID;

public interface FilterParser {

    /**
     * @throws IllegalArgumentException if the date range is missing or inverted
     */
    ParsedFilters parseFilters(UUID websiteId, QueryFilters filters);
}
