package com.tapas.sitestats.stats.repository;

import com.tapas.sitestats.stats.domain.FilterColumn;
import com.tapas.sitestats.stats.domain.QueryFilters;
import org.springframework.stereotype.Component;

/**
 * ClickHouse filters. Session attributes are columns of the event tables, so
 * no join is ever produced.
 */
@Component
public class ClickHouseFilterParser extends AbstractFilterParser {

    @Override
    protected String columnName(FilterColumn column) {
        return column.column();
    }

    @Override
    protected String joinSession(QueryFilters filters) {
        return "";
    }
}
