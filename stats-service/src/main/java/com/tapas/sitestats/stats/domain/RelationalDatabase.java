package com.tapas.sitestats.stats.domain;

/**
 * Relational database behind the relational backend, set through
 * {@code analytics.relational-dialect}.
 */
public enum RelationalDatabase {
    POSTGRESQL,
    MYSQL
}
