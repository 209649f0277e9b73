package com.dealgrid.app.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Error sentinels stored as cell values. They render as their literal text.
 */
public enum CellError {
    ERROR("#ERROR!"),
    REF("#REF!"),
    NA("#N/A"),
    CIRCULAR("#CIRCULAR!");

    private final String sentinel;

    CellError(String sentinel) {
        this.sentinel = sentinel;
    }

    @JsonValue
    public String getSentinel() {
        return sentinel;
    }

    /**
     * Returns the error whose sentinel equals the text (ignoring case), or null.
     */
    public static CellError fromSentinel(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        for (CellError error : values()) {
            if (error.sentinel.equalsIgnoreCase(trimmed)) {
                return error;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return sentinel;
    }
}
