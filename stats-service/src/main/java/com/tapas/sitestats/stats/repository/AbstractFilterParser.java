package com.tapas.sitestats.stats.repository;

import com.tapas.sitestats.stats.domain.FilterColumn;
import com.tapas.sitestats.stats.domain.QueryFilters;

import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Shared filter rendering. Every parser binds {@code websiteId},
 * {@code startDate}, {@code endDate} and, when set, {@code eventType}; each
 * dimension filter becomes one {@code and} predicate bound under its filter key.
 */
public abstract class AbstractFilterParser implements FilterParser {

    @Override
    public ParsedFilters parseFilters(UUID websiteId, QueryFilters filters) {
        if (filters.startDate() == null || filters.endDate() == null) {
            throw new IllegalArgumentException("startDate and endDate are required");
        }
        if (filters.startDate().isAfter(filters.endDate())) {
            throw new IllegalArgumentException("startDate must not be after endDate");
        }

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("websiteId", bindWebsiteId(websiteId));
        params.put("startDate", Timestamp.from(filters.startDate()));
        params.put("endDate", Timestamp.from(filters.endDate()));
        if (filters.eventType() != null) {
            params.put("eventType", filters.eventType().value());
        }

        var filterQuery = new StringBuilder();
        filters.dimensions().forEach((column, value) -> {
            filterQuery.append("and ")
                    .append(value.operator().render(columnName(column), column.key()))
                    .append('\n');
            params.put(column.key(), value.operator().bind(value.value()));
        });

        return new ParsedFilters(filterQuery.toString(), joinSession(filters), params);
    }

    protected Object bindWebsiteId(UUID websiteId) {
        return websiteId;
    }

    /**
     * Column reference as it appears in this backend's query.
     */
    protected abstract String columnName(FilterColumn column);

    protected abstract String joinSession(QueryFilters filters);
}
