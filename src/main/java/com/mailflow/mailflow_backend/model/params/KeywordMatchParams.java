package com.mailflow.mailflow_backend.model.params;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public record KeywordMatchParams(List<String> keywords, String location) implements NodeParameters {

    private static final Set<String> LOCATIONS = Set.of("subject", "body", "both");

    public String location() {
        return location != null ? location : "both";
    }

    public boolean searchesSubject() {
        return "subject".equals(location()) || "both".equals(location());
    }

    public boolean searchesBody() {
        return "body".equals(location()) || "both".equals(location());
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (keywords == null || keywords.isEmpty()) {
            problems.add("keywords must not be empty");
        }
        if (!LOCATIONS.contains(location())) {
            problems.add("location must be one of subject, body, both");
        }
        return problems;
    }
}
