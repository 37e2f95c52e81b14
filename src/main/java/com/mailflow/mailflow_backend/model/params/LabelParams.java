package com.mailflow.mailflow_backend.model.params;

import java.util.List;

/** Label name used by add_label and remove_label; resolved to an id at run time. */
public record LabelParams(String label) implements NodeParameters {

    @Override
    public List<String> validate() {
        return NodeParameters.isBlank(label) ? List.of("label is required") : List.of();
    }
}
