package com.mailflow.mailflow_backend.model.result;

import java.util.List;

public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings));
    }
}
