package com.mailflow.mailflow_backend.model.dto;

import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.trigger.TriggerContext;

import java.util.Collections;
import java.util.List;

/**
 * Request body for POST /api/workflows/test.
 */
public record TestWorkflowRequest(
    String userId,
    String connectionId,
    List<WorkflowNode> nodes,
    WorkflowConnections connections,
    TriggerContext triggerContext
) {
    public List<WorkflowNode> nodes() {
        return nodes != null ? nodes : Collections.emptyList();
    }

    public WorkflowConnections connections() {
        return connections != null ? connections : new WorkflowConnections();
    }
}
