package com.tapas.sitestats.stats.repository;

import com.tapas.sitestats.stats.domain.FilterColumn;
import com.tapas.sitestats.stats.domain.QueryFilters;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Relational filters. Session attributes need {@code website_event} joined to
 * {@code session}.
 */
@Component
public class RelationalFilterParser extends AbstractFilterParser {

    static final String JOIN_SESSION = """
            inner join session
              on session.session_id = website_event.session_id
             and session.website_id = website_event.website_id
            """;

    private final RelationalDialect dialect;

    public RelationalFilterParser(RelationalDialect dialect) {
        this.dialect = dialect;
    }

    @Override
    protected Object bindWebsiteId(UUID websiteId) {
        return dialect.bindUuid(websiteId);
    }

    @Override
    protected String columnName(FilterColumn column) {
        return (column.isSessionColumn() ? "session." : "website_event.") + column.column();
    }

    @Override
    protected String joinSession(QueryFilters filters) {
        return filters.hasSessionColumn() ? JOIN_SESSION : "";
    }
}
