package com.tapas.sitestats.stats.domain;

import java.util.Objects;

/**
 * A single dimension filter: operator plus the value it compares against.
 */
public record FilterValue(FilterOperator operator, String value) {

    public FilterValue {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    public static FilterValue eq(String value) {
        return new FilterValue(FilterOperator.EQUALS, value);
    }

    /**
     * Parses the request form {@code op.value}, e.g. {@code c./blog}.
     * A prefix that is not a known operator code is part of the value
     * ({@code example.com} stays an equality match on {@code example.com}).
     */
    public static FilterValue parse(String raw) {
        int dot = raw.indexOf('.');
        if (dot > 0) {
            var operator = FilterOperator.fromCode(raw.substring(0, dot));
            if (operator.isPresent()) {
                return new FilterValue(operator.get(), raw.substring(dot + 1));
            }
        }
        return eq(raw);
    }
}
