package com.mailflow.mailflow_backend.model.result;

public record TriggerEvaluationResult(boolean triggered, String matchedTriggerId) {

    public static TriggerEvaluationResult none() {
        return new TriggerEvaluationResult(false, null);
    }

    public static TriggerEvaluationResult matched(String triggerId) {
        return new TriggerEvaluationResult(true, triggerId);
    }
}
