package com.tapas.sitestats.stats.repository;

import java.util.Map;

/**
 * Output of a {@link FilterParser}: extra {@code and ...} predicates, an optional
 * join clause and the named parameters both of them reference.
 */
public record ParsedFilters(
        String filterQuery,
        String joinSession,
        Map<String, Object> params) {
}
