package com.mailflow.mailflow_backend.model.trigger;

import com.fasterxml.jackson.annotation.JsonValue;

/** Payload of an email_labeled event. */
public record LabelChange(String label, LabelAction action) {

    public enum LabelAction {
        ADDED,
        REMOVED;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }
    }
}
