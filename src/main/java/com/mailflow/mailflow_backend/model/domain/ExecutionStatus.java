package com.mailflow.mailflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    /** Terminal records are never executed again. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
