package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.config.MailflowProperties;
import com.mailflow.mailflow_backend.executor.ActionContext;
import com.mailflow.mailflow_backend.mail.MailDriver;
import com.mailflow.mailflow_backend.mail.MailDriverResolver;
import com.mailflow.mailflow_backend.model.domain.ExecutionStatus;
import com.mailflow.mailflow_backend.model.domain.NodeCategory;
import com.mailflow.mailflow_backend.model.domain.Workflow;
import com.mailflow.mailflow_backend.model.domain.WorkflowExecution;
import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.result.ExecutionResult;
import com.mailflow.mailflow_backend.model.result.NodeExecutionResult;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import com.mailflow.mailflow_backend.repository.WorkflowExecutionRepository;
import com.mailflow.mailflow_backend.repository.WorkflowRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs a persisted execution record against its workflow and stores the outcome.
 *
 * <p>Re-running a record that is already completed or failed is a no-op, so a queue that
 * redelivers the same execution id cannot apply actions twice.
 */
@Slf4j
@Service
public class WorkflowExecutor {

    private final WorkflowExecutionRepository executionRepository;
    private final WorkflowRepository          workflowRepository;
    private final BranchWalker                branchWalker;
    private final MailDriverResolver          mailDriverResolver;
    private final ExecutionEventPublisher     eventPublisher;
    private final MailflowProperties          properties;

    public WorkflowExecutor(WorkflowExecutionRepository executionRepository,
                            WorkflowRepository workflowRepository,
                            BranchWalker branchWalker,
                            MailDriverResolver mailDriverResolver,
                            ExecutionEventPublisher eventPublisher,
                            MailflowProperties properties) {
        this.executionRepository = executionRepository;
        this.workflowRepository = workflowRepository;
        this.branchWalker = branchWalker;
        this.mailDriverResolver = mailDriverResolver;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
    }

    public ExecutionResult execute(UUID executionId) {
        Optional<WorkflowExecution> found = executionRepository.findById(executionId);
        if (found.isEmpty()) {
            return ExecutionResult.failed("Execution " + executionId + " not found");
        }
        WorkflowExecution execution = found.get();

        if (execution.getStatus().isTerminal()) {
            log.info("[WorkflowExecutor] Execution {} already {}, skipping", executionId, execution.getStatus().toJson());
            return ExecutionResult.skipped(execution.getStatus());
        }

        Workflow workflow = workflowRepository.findById(execution.getWorkflowId()).orElse(null);
        if (workflow == null) {
            String error = "Workflow " + execution.getWorkflowId() + " not found";
            finish(execution, ExecutionStatus.FAILED, null, error);
            return ExecutionResult.failed(error);
        }

        execution.setStatus(ExecutionStatus.RUNNING);
        executionRepository.save(execution);

        ExecutionRun run = null;
        try {
            WorkflowNode trigger = findStartTrigger(workflow.getNodes(), execution.getTriggerNodeId());
            if (trigger == null) {
                String error = "No trigger found in workflow";
                finish(execution, ExecutionStatus.FAILED, null, error);
                return ExecutionResult.failed(error);
            }

            MailDriver mailDriver = mailDriverResolver.forConnection(workflow.getConnectionId());
            TriggerData triggerData = TriggerData.from(execution.getTriggerData());
            ActionContext actionContext = ActionContext.builder()
                    .connectionId(workflow.getConnectionId())
                    .triggerData(triggerData)
                    .dryRun(false)
                    .envVars(properties.getEnv())
                    .mailDriver(mailDriver)
                    .build();

            run = new ExecutionRun(workflow.getNodes(), workflow.getConnections(), triggerData,
                    actionContext, workflow.getUserId(), eventPublisher.listenerFor(executionId));

            log.info("[WorkflowExecutor] Execution {} of workflow '{}' starting at {}",
                    executionId, workflow.getName(), trigger.getId());
            branchWalker.walk(run, trigger.getId()).join();

            Map<String, NodeExecutionResult> results = run.orderedResults();
            finish(execution, ExecutionStatus.COMPLETED, results, null);
            log.info("[WorkflowExecutor] Execution {} completed, {} node(s) run", executionId, results.size());
            return ExecutionResult.completed(results);

        } catch (Exception e) {
            String error = BranchWalker.messageOf(e);
            log.error("[WorkflowExecutor] Execution {} failed: {}", executionId, error, e);
            Map<String, NodeExecutionResult> partial = run != null ? run.orderedResults() : null;
            try {
                finish(execution, ExecutionStatus.FAILED, partial, error);
            } catch (RuntimeException persistError) {
                log.error("[WorkflowExecutor] Could not store failure of execution {}", executionId, persistError);
            }
            return ExecutionResult.failed(error, partial);
        }
    }

    /** The trigger recorded on the execution when it still exists, otherwise the first trigger. */
    static WorkflowNode findStartTrigger(List<WorkflowNode> nodes, String recordedTriggerId) {
        if (nodes == null) {
            return null;
        }
        if (recordedTriggerId != null) {
            for (WorkflowNode node : nodes) {
                if (recordedTriggerId.equals(node.getId()) && node.getCategory() == NodeCategory.TRIGGER) {
                    return node;
                }
            }
        }
        return nodes.stream()
                .filter(n -> n.getCategory() == NodeCategory.TRIGGER)
                .findFirst()
                .orElse(null);
    }

    // A record a concurrent writer (the timeout watchdog) already closed keeps its status
    private void finish(WorkflowExecution execution, ExecutionStatus status,
                        Map<String, NodeExecutionResult> results, String error) {
        WorkflowExecution current = executionRepository.findById(execution.getId()).orElse(execution);
        if (current != execution && current.getStatus().isTerminal()) {
            log.warn("[WorkflowExecutor] Execution {} was already {}, not overwriting with {}",
                    execution.getId(), current.getStatus().toJson(), status.toJson());
            return;
        }
        execution.setStatus(status);
        execution.setNodeResults(results);
        execution.setError(error);
        execution.setCompletedAt(Instant.now());
        executionRepository.save(execution);
        eventPublisher.executionFinished(execution.getId(), status, error);
    }
}
