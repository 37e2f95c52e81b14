package com.mailflow.mailflow_backend.model.result;

import java.util.List;
import java.util.UUID;

/**
 * What one inbound mail event started: the executions created and the workflows that failed.
 */
public record TriggerResult(List<TriggeredWorkflow> triggeredWorkflows, List<TriggerError> errors) {

    public record TriggeredWorkflow(UUID workflowId, String workflowName, UUID executionId, String matchedTriggerId) {}

    public record TriggerError(UUID workflowId, String error) {}
}
