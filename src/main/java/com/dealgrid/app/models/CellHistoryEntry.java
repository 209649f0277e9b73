package com.dealgrid.app.models;

import java.time.Instant;

/**
 * One audit record: the value a cell held before a write, and when the write happened.
 */
public class CellHistoryEntry {
    private final Object value;
    private final Instant timestamp;

    public CellHistoryEntry(Object value, Instant timestamp) {
        this.value = value;
        this.timestamp = timestamp;
    }

    public Object getValue() {
        return value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
