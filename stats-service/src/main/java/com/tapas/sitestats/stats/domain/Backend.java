package com.tapas.sitestats.stats.domain;

/**
 * Storage backend the stats queries run against.
 * Chosen once per process through {@code analytics.backend}.
 */
public enum Backend {
    RELATIONAL,
    COLUMNAR
}
