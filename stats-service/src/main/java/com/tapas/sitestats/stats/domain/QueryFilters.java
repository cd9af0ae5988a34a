package com.tapas.sitestats.stats.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Filters for one stats query: an inclusive date range, an optional event type
 * and any number of dimension filters. Immutable; the {@code with*} methods
 * return copies.
 */
public record QueryFilters(
        Instant startDate,
        Instant endDate,
        EventType eventType,
        Map<FilterColumn, FilterValue> dimensions) {

    public QueryFilters {
        dimensions = dimensions == null || dimensions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(dimensions));
    }

    public static QueryFilters between(Instant startDate, Instant endDate) {
        return new QueryFilters(startDate, endDate, null, Map.of());
    }

    public QueryFilters withEventType(EventType type) {
        return new QueryFilters(startDate, endDate, type, dimensions);
    }

    public QueryFilters with(FilterColumn column, FilterValue value) {
        var copy = new EnumMap<FilterColumn, FilterValue>(FilterColumn.class);
        copy.putAll(dimensions);
        copy.put(column, value);
        return new QueryFilters(startDate, endDate, eventType, copy);
    }

    /**
     * True when at least one dimension can only be answered from raw event rows.
     */
    public boolean hasEventColumn() {
        return dimensions.keySet().stream().anyMatch(FilterColumn::isEventColumn);
    }

    public boolean hasSessionColumn() {
        return dimensions.keySet().stream().anyMatch(FilterColumn::isSessionColumn);
    }
}
