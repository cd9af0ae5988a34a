package com.tapas.sitestats.stats.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Comparison applied by a dimension filter. Renders a named-parameter predicate
 * and converts the raw filter value into the value bound to that parameter.
 */
public enum FilterOperator {
    EQUALS("eq") {
        @Override
        public String render(String column, String param) {
            return column + " = :" + param;
        }
    },
    NOT_EQUALS("neq") {
        @Override
        public String render(String column, String param) {
            return column + " != :" + param;
        }
    },
    CONTAINS("c") {
        @Override
        public String render(String column, String param) {
            return "lower(" + column + ") like :" + param;
        }

        @Override
        public Object bind(String value) {
            return likePattern(value);
        }
    },
    DOES_NOT_CONTAIN("dnc") {
        @Override
        public String render(String column, String param) {
            return "lower(" + column + ") not like :" + param;
        }

        @Override
        public Object bind(String value) {
            return likePattern(value);
        }
    };

    private final String code;

    FilterOperator(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public abstract String render(String column, String param);

    public Object bind(String value) {
        return value;
    }

    public static Optional<FilterOperator> fromCode(String code) {
        return Arrays.stream(values())
                .filter(op -> op.code.equals(code))
                .findFirst();
    }

    private static String likePattern(String value) {
        return "%" + value.toLowerCase(Locale.ROOT) + "%";
    }
}
