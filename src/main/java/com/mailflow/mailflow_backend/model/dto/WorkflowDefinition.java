package com.mailflow.mailflow_backend.model.dto;

import com.mailflow.mailflow_backend.model.domain.WorkflowSettings;

import java.util.Collections;
import java.util.List;

/**
 * Exchange shape of a whole workflow.
 * Null-safe: null node list and connections are treated as empty.
 */
public record WorkflowDefinition(
    String name,
    String description,
    Boolean active,
    List<WorkflowDefinitionNode> nodes,
    WorkflowConnections connections,
    WorkflowSettings settings
) {
    public List<WorkflowDefinitionNode> nodes() {
        return nodes != null ? nodes : Collections.emptyList();
    }

    public WorkflowConnections connections() {
        return connections != null ? connections : new WorkflowConnections();
    }
}
