package com.tapas.sitestats.stats.repository;

import java.util.UUID;

/**
 * MySQL keeps ids in {@code varchar(36)} columns.
 */
public class MySqlDialect implements RelationalDialect {

    @Override
    public String timestampDiff(String start, String end) {
        return "timestampdiff(second, " + start + ", " + end + ")";
    }

    @Override
    public Object bindUuid(UUID value) {
        return value.toString();
    }
}
