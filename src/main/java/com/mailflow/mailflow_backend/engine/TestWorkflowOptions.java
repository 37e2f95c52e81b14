package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.dto.WorkflowConnections;
import com.mailflow.mailflow_backend.model.trigger.TriggerContext;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Input of a dry run. userId enables ai_classification; without it those nodes route to "other".
 */
@Builder
public record TestWorkflowOptions(
    List<WorkflowNode> nodes,
    WorkflowConnections connections,
    TriggerContext triggerContext,
    String userId,
    String connectionId,
    Map<String, String> envVars
) {}
