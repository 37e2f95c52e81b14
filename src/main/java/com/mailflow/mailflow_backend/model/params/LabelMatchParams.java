package com.mailflow.mailflow_backend.model.params;

import java.util.ArrayList;
import java.util.List;

public record LabelMatchParams(List<String> labels, String mode) implements NodeParameters {

    public static final String MODE_ANY = "any";
    public static final String MODE_ALL = "all";

    public String mode() {
        return mode != null ? mode : MODE_ANY;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (labels == null || labels.isEmpty()) {
            problems.add("labels must not be empty");
        }
        if (!MODE_ANY.equals(mode()) && !MODE_ALL.equals(mode())) {
            problems.add("mode must be 'any' or 'all'");
        }
        return problems;
    }
}
