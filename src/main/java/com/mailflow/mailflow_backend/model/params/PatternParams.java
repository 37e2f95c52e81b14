package com.mailflow.mailflow_backend.model.params;

import java.util.List;

/** Glob pattern used by sender_match and subject_match. */
public record PatternParams(String pattern) implements NodeParameters {

    @Override
    public List<String> validate() {
        return NodeParameters.isBlank(pattern) ? List.of("pattern is required") : List.of();
    }
}
