package com.mailflow.mailflow_backend.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Result of a dry run. executionPath lists node ids in the order they were entered.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestWorkflowResult(
    boolean success,
    Map<String, NodeExecutionResult> nodeResults,
    List<String> executionPath,
    String error
) {}
