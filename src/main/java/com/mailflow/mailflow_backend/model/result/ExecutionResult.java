package com.mailflow.mailflow_backend.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mailflow.mailflow_backend.model.domain.ExecutionStatus;

import java.util.Map;

/**
 * Outcome of WorkflowExecutor.execute. skipped is set when the record was already terminal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(
    boolean success,
    ExecutionStatus status,
    Boolean skipped,
    Map<String, NodeExecutionResult> nodeResults,
    String error
) {
    public static ExecutionResult completed(Map<String, NodeExecutionResult> nodeResults) {
        return new ExecutionResult(true, ExecutionStatus.COMPLETED, null, nodeResults, null);
    }

    public static ExecutionResult failed(String error) {
        return new ExecutionResult(false, ExecutionStatus.FAILED, null, null, error);
    }

    public static ExecutionResult failed(String error, Map<String, NodeExecutionResult> partialResults) {
        return new ExecutionResult(false, ExecutionStatus.FAILED, null, partialResults, error);
    }

    public static ExecutionResult skipped(ExecutionStatus status) {
        return new ExecutionResult(true, status, true, null, null);
    }
}
