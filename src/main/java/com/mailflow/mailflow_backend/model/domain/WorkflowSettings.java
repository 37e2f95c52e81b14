package com.mailflow.mailflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-workflow settings, stored as JSON on the workflow row.
 * Keys the engine does not know about are kept so they round-trip unchanged.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowSettings {

    private Integer maxExecutionsPerHour;

    /** Milliseconds. Enforced by the dispatching service, not by the walk itself. */
    private Long executionTimeout;

    private Boolean retryOnFailure;

    private Integer maxRetries;

    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }
}
