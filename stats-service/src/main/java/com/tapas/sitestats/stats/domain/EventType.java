package com.tapas.sitestats.stats.domain;

public enum EventType {
    PAGE_VIEW(1),
    CUSTOM_EVENT(2);

    private final int value;

    EventType(int value) {
        this.value = value;
    }

    /**
     * Value stored in the {@code event_type} column.
     */
    public int value() {
        return value;
    }
}
