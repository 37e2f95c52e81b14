package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.config.AsyncConfig;
import com.mailflow.mailflow_backend.executor.ActionExecutor;
import com.mailflow.mailflow_backend.executor.ConditionEvaluator;
import com.mailflow.mailflow_backend.model.domain.NodeCategory;
import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.result.NodeExecutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Depth-first traversal shared by real executions and dry runs.
 *
 * <p>Each node runs at most once per run. After a node finishes, every target of the chosen
 * output port is walked concurrently on the workflow executor. Nothing here blocks on a sibling
 * branch; the returned future completes when the whole subtree is done, or exceptionally when
 * something outside a node's own error handling fails (a listener, a rejected task).
 */
@Slf4j
@Component
public class BranchWalker {

    private final ConditionEvaluator conditionEvaluator;
    private final ActionExecutor     actionExecutor;
    private final Executor           executor;

    public BranchWalker(ConditionEvaluator conditionEvaluator,
                        ActionExecutor actionExecutor,
                        @Qualifier(AsyncConfig.WORKFLOW_EXECUTOR) Executor executor) {
        this.conditionEvaluator = conditionEvaluator;
        this.actionExecutor = actionExecutor;
        this.executor = executor;
    }

    public CompletableFuture<Void> walk(ExecutionRun run, String nodeId) {
        if (!run.markVisited(nodeId)) {
            return CompletableFuture.completedFuture(null);
        }
        WorkflowNode node = run.node(nodeId);
        if (node == null) {
            return CompletableFuture.completedFuture(null);
        }

        run.enter(nodeId);
        return runNode(run, node).thenCompose(result -> {
            run.record(nodeId, result);
            if (!shouldContinue(node, result)) {
                return CompletableFuture.completedFuture(null);
            }
            int port = result.getOutputIndex() != null ? result.getOutputIndex() : 0;
            List<String> targets = run.getConnections().targetsOf(nodeId, port);
            return fanOut(run, targets);
        });
    }

    private CompletableFuture<Void> fanOut(ExecutionRun run, List<String> targets) {
        if (targets.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<?>[] branches = targets.stream()
                .map(target -> CompletableFuture
                        .supplyAsync(() -> walk(run, target), executor)
                        .thenCompose(branch -> branch))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(branches);
    }

    private CompletableFuture<NodeExecutionResult> runNode(ExecutionRun run, WorkflowNode node) {
        if (node.isDisabled()) {
            return CompletableFuture.completedFuture(NodeExecutionResult.skipped());
        }

        NodeCategory category = node.getCategory() != null ? node.getCategory() : NodeCategory.UNKNOWN;
        switch (category) {
            case TRIGGER:
                return CompletableFuture.completedFuture(NodeExecutionResult.passedThrough());
            case CONDITION:
                return conditionEvaluator
                        .evaluateAsync(node.getNodeType(), run.getTriggerData(), node.getParameters(), run.getUserId())
                        .thenApply(NodeExecutionResult::fromCondition)
                        .exceptionally(ex -> {
                            String message = messageOf(ex);
                            log.warn("[BranchWalker] Condition {} ({}) failed: {}", node.getId(), node.getNodeType(), message);
                            return NodeExecutionResult.failed(true, message);
                        });
            case ACTION:
                NodeExecutionResult actionResult = NodeExecutionResult.fromAction(
                        actionExecutor.execute(node.getNodeType(), run.getActionContext(), node.getParameters()));
                if (!actionResult.isPassed()) {
                    log.warn("[BranchWalker] Action {} ({}) failed: {}", node.getId(), node.getNodeType(), actionResult.getError());
                }
                return CompletableFuture.completedFuture(actionResult);
            default:
                String value = node.getCategory() != null ? node.getCategory().getValue() : null;
                log.warn("[BranchWalker] Unknown node type: {} on node {}", value, node.getId());
                return CompletableFuture.completedFuture(
                        NodeExecutionResult.failed(false, "Unknown node type: " + value));
        }
    }

    /** A failed node ends its branch, unless it is a condition that still picked a port. */
    private static boolean shouldContinue(WorkflowNode node, NodeExecutionResult result) {
        if (result.isPassed()) {
            return true;
        }
        return node.getCategory() == NodeCategory.CONDITION && result.getOutputIndex() != null;
    }

    static String messageOf(Throwable ex) {
        Throwable cause = ex;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
