package com.mailflow.mailflow_backend.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a condition node. A null outputIndex means the condition does not pick a port.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionResult(boolean passed, Integer outputIndex, String category) {

    /** Wraps a plain boolean condition: port 0 when it passed, no port otherwise. */
    public static ConditionResult ofBoolean(boolean passed) {
        return new ConditionResult(passed, passed ? 0 : null, null);
    }

    public static ConditionResult routed(int outputIndex, String category) {
        return new ConditionResult(true, outputIndex, category);
    }
}
