package com.tapas.sitestats.stats.repository;

public class PostgresDialect implements RelationalDialect {

    @Override
    public String timestampDiff(String start, String end) {
        return "floor(extract(epoch from (" + end + " - " + start + ")))";
    }
}
