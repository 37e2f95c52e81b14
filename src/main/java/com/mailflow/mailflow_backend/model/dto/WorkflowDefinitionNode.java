package com.mailflow.mailflow_backend.model.dto;

import java.util.List;
import java.util.Map;

/**
 * A node in the import/export format. The type is the qualified name, e.g. "zero:senderMatch".
 */
public record WorkflowDefinitionNode(
    String id,
    String name,
    String type,
    Integer typeVersion,
    List<Double> position,
    Map<String, Object> parameters,
    Boolean disabled
) {}
