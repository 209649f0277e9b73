package com.dealgrid.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A style rule applied to every cell of a range whose value meets the condition.
 * value2 is only used by BETWEEN (inclusive upper bound).
 */
public class ConditionalFormat {
    private String id;
    private final String range;
    private final ConditionKind condition;
    private final Object value;
    private final Object value2;
    private final Map<String, Object> style;

    @JsonCreator
    public ConditionalFormat(@JsonProperty("id") String id,
                             @JsonProperty("range") String range,
                             @JsonProperty("condition") ConditionKind condition,
                             @JsonProperty("value") Object value,
                             @JsonProperty("value2") Object value2,
                             @JsonProperty("style") Map<String, Object> style) {
        this.id = id;
        this.range = range;
        this.condition = condition;
        this.value = CellValues.normalize(value);
        this.value2 = CellValues.normalize(value2);
        this.style = style == null ? new LinkedHashMap<>() : new LinkedHashMap<>(style);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getRange() {
        return range;
    }

    public ConditionKind getCondition() {
        return condition;
    }

    public Object getValue() {
        return value;
    }

    public Object getValue2() {
        return value2;
    }

    public Map<String, Object> getStyle() {
        return Collections.unmodifiableMap(style);
    }
}
