package com.mailflow.mailflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeCategory {
    TRIGGER("trigger"),
    CONDITION("condition"),
    ACTION("action"),
    UNKNOWN("unknown");  // qualified type not found in the node table

    private final String value;

    NodeCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static NodeCategory fromValue(String value) {
        for (NodeCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
