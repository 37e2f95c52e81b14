package com.mailflow.mailflow_backend.service;

import com.mailflow.mailflow_backend.config.AsyncConfig;
import com.mailflow.mailflow_backend.config.MailflowProperties;
import com.mailflow.mailflow_backend.engine.WorkflowExecutor;
import com.mailflow.mailflow_backend.model.domain.ExecutionStatus;
import com.mailflow.mailflow_backend.model.domain.Workflow;
import com.mailflow.mailflow_backend.model.domain.WorkflowExecution;
import com.mailflow.mailflow_backend.model.domain.WorkflowSettings;
import com.mailflow.mailflow_backend.model.result.ExecutionResult;
import com.mailflow.mailflow_backend.repository.WorkflowExecutionRepository;
import com.mailflow.mailflow_backend.repository.WorkflowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs executions in the background and enforces the workflow's execution timeout.
 * The walk itself is not interrupted on timeout; its record is closed as failed and the late
 * outcome is not written over it.
 */
@Slf4j
@Service
public class WorkflowExecutionService {

    private final WorkflowExecutor            workflowExecutor;
    private final WorkflowExecutionRepository executionRepository;
    private final WorkflowRepository          workflowRepository;
    private final MailflowProperties          properties;
    private final Executor                    executor;

    public WorkflowExecutionService(WorkflowExecutor workflowExecutor,
                                    WorkflowExecutionRepository executionRepository,
                                    WorkflowRepository workflowRepository,
                                    MailflowProperties properties,
                                    @Qualifier(AsyncConfig.DISPATCH_EXECUTOR) Executor executor) {
        this.workflowExecutor = workflowExecutor;
        this.executionRepository = executionRepository;
        this.workflowRepository = workflowRepository;
        this.properties = properties;
        this.executor = executor;
    }

    public CompletableFuture<ExecutionResult> dispatch(UUID executionId) {
        long timeoutMs = timeoutFor(executionId);
        return CompletableFuture
                .supplyAsync(() -> workflowExecutor.execute(executionId), executor)
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof TimeoutException) {
                        String error = "Execution timed out after " + timeoutMs + " ms";
                        markTimedOut(executionId, error);
                        return ExecutionResult.failed(error);
                    }
                    String error = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                    log.error("[WorkflowExecution] Dispatch of {} failed: {}", executionId, error, cause);
                    return ExecutionResult.failed(error);
                });
    }

    long timeoutFor(UUID executionId) {
        long fallback = properties.getExecutions().getDefaultTimeoutMs();
        return executionRepository.findById(executionId)
                .flatMap(execution -> workflowRepository.findById(execution.getWorkflowId()))
                .map(Workflow::getSettings)
                .map(WorkflowSettings::getExecutionTimeout)
                .filter(timeout -> timeout > 0)
                .orElse(fallback);
    }

    private void markTimedOut(UUID executionId, String error) {
        log.warn("[WorkflowExecution] {}: {}", executionId, error);
        WorkflowExecution execution = executionRepository.findById(executionId).orElse(null);
        if (execution == null || execution.getStatus().isTerminal()) {
            return;
        }
        execution.setStatus(ExecutionStatus.FAILED);
        execution.setError(error);
        execution.setCompletedAt(Instant.now());
        executionRepository.save(execution);
    }
}
