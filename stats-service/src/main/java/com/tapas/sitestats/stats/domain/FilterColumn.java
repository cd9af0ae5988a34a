package com.tapas.sitestats.stats.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Filter keys accepted by the stats queries.
 * <p>
 * Event columns only exist on raw {@code website_event} rows, so filtering on
 * one of them rules out the hourly rollup on the columnar backend. Session
 * columns live on the {@code session} table in the relational schema and are
 * denormalised onto the event tables in ClickHouse.
 */
public enum FilterColumn {
    URL("url", "url_path", Scope.EVENT),
    REFERRER("referrer", "referrer_domain", Scope.EVENT),
    TITLE("title", "page_title", Scope.EVENT),
    QUERY("query", "url_query", Scope.EVENT),
    EVENT("event", "event_name", Scope.EVENT),
    HOST("host", "hostname", Scope.EVENT),
    TAG("tag", "tag", Scope.EVENT),
    OS("os", "os", Scope.SESSION),
    BROWSER("browser", "browser", Scope.SESSION),
    DEVICE("device", "device", Scope.SESSION),
    SCREEN("screen", "screen", Scope.SESSION),
    LANGUAGE("language", "language", Scope.SESSION),
    COUNTRY("country", "country", Scope.SESSION),
    REGION("region", "region", Scope.SESSION),
    CITY("city", "city", Scope.SESSION);

    private enum Scope { EVENT, SESSION }

    private final String key;
    private final String column;
    private final Scope scope;

    FilterColumn(String key, String column, Scope scope) {
        this.key = key;
        this.column = column;
        this.scope = scope;
    }

    public String key() {
        return key;
    }

    public String column() {
        return column;
    }

    public boolean isEventColumn() {
        return scope == Scope.EVENT;
    }

    public boolean isSessionColumn() {
        return scope == Scope.SESSION;
    }

    public static Optional<FilterColumn> fromKey(String key) {
        return Arrays.stream(values())
                .filter(c -> c.key.equals(key))
                .findFirst();
    }
}
