package com.memory.graph.core.model;

import java.util.Locale;

/**
 * Lifecycle of an entry's extraction.
 * An entry moves {@code PENDING -> RUNNING -> SUCCEEDED | FAILED} once per extraction cycle.
 */
public enum ExtractionStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    /**
     * Lower-case name used on the wire and in the store.
     */
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public static ExtractionStatus fromWireValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
