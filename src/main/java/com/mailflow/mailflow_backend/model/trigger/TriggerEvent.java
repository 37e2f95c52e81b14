package com.mailflow.mailflow_backend.model.trigger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kinds of inbound event a trigger node can react to. */
public enum TriggerEvent {
    EMAIL_RECEIVED("email_received"),
    EMAIL_LABELED("email_labeled"),
    SCHEDULE("schedule");

    private final String value;

    TriggerEvent(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() { return value; }

    @JsonCreator
    public static TriggerEvent fromValue(String value) {
        for (TriggerEvent event : values()) {
            if (event.value.equalsIgnoreCase(value) || event.name().equalsIgnoreCase(value)) {
                return event;
            }
        }
        throw new IllegalArgumentException("Unknown trigger event: " + value);
    }
}
