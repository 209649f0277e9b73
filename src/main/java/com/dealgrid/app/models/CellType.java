package com.dealgrid.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Display classification of a cell. Does not affect evaluation.
 */
public enum CellType {
    TEXT,
    NUMBER,
    CURRENCY,
    PERCENTAGE,
    DATE,
    BOOLEAN,
    FORMULA,
    LINK;

    /**
     * Allows case-insensitive JSON input, e.g. "currency" -> CURRENCY.
     */
    @JsonCreator
    public static CellType fromValue(String value) {
        return CellType.valueOf(value.trim().toUpperCase());
    }
}
