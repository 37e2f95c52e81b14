package com.mailflow.mailflow_backend.model.params;

import java.util.ArrayList;
import java.util.List;

/** Both fields are optional filters; a missing one matches any label change. */
public record EmailLabeledParams(String label, String action) implements NodeParameters {

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (action != null && !"added".equals(action) && !"removed".equals(action)) {
            problems.add("action must be 'added' or 'removed'");
        }
        return problems;
    }
}
