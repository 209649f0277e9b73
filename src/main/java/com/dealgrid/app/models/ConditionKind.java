package com.dealgrid.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Condition tested by a conditional format rule.
 */
public enum ConditionKind {
    EQUALS,
    GREATER,
    LESS,
    BETWEEN,
    CONTAINS,
    DUPLICATE,
    UNIQUE;

    @JsonCreator
    public static ConditionKind fromValue(String value) {
        return ConditionKind.valueOf(value.trim().toUpperCase());
    }
}
