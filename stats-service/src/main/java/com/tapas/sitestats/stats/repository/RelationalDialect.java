package com.tapas.sitestats.stats.repository;

import java.util.UUID;

/**
 * SQL that differs between the supported relational databases.
 */
public interface RelationalDialect {

    /**
     * Expression for the whole seconds elapsed from {@code start} to {@code end}.
     */
    String timestampDiff(String start, String end);

    default Object bindUuid(UUID value) {
        return value;
    }
}
