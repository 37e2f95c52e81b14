package com.mailflow.mailflow_backend.model.params;

import java.util.Collections;
import java.util.List;

/**
 * Output port N routes emails classified as categories[N]; port categories.size() is "other".
 */
public record AiClassificationParams(List<String> categories) implements NodeParameters {

    public List<String> categories() {
        return categories != null ? categories : Collections.emptyList();
    }

    @Override
    public List<String> validate() {
        return categories().isEmpty() ? List.of("categories must not be empty") : List.of();
    }
}
