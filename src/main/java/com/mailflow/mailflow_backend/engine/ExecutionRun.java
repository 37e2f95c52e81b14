package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.executor.ActionContext;
import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.dto.WorkflowConnections;
import com.mailflow.mailflow_backend.model.result.NodeExecutionResult;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable state of one traversal, shared by every branch of the run.
 * Branches may run on different threads; all shared collections are thread-safe.
 */
@Getter
public class ExecutionRun {

    private final Map<String, WorkflowNode> nodeMap;
    private final WorkflowConnections connections;
    private final TriggerData triggerData;
    private final ActionContext actionContext;
    private final String userId;
    private final NodeListener listener;

    private final Set<String> visited = ConcurrentHashMap.newKeySet();
    private final Map<String, NodeExecutionResult> results = new ConcurrentHashMap<>();
    private final List<String> path = Collections.synchronizedList(new ArrayList<>());

    public ExecutionRun(List<WorkflowNode> nodes,
                        WorkflowConnections connections,
                        TriggerData triggerData,
                        ActionContext actionContext,
                        String userId,
                        NodeListener listener) {
        this.nodeMap = new LinkedHashMap<>();
        nodes.forEach(n -> nodeMap.put(n.getId(), n));
        this.connections = connections != null ? connections : new WorkflowConnections();
        this.triggerData = triggerData;
        this.actionContext = actionContext;
        this.userId = userId;
        this.listener = listener != null ? listener : NodeListener.NONE;
    }

    /** Atomic check-and-set: true only for the first branch to reach the node. */
    boolean markVisited(String nodeId) {
        return visited.add(nodeId);
    }

    WorkflowNode node(String nodeId) {
        return nodeMap.get(nodeId);
    }

    void enter(String nodeId) {
        path.add(nodeId);
        listener.nodeStarted(nodeId);
    }

    void record(String nodeId, NodeExecutionResult result) {
        results.put(nodeId, result);
        listener.nodeCompleted(nodeId, result);
    }

    public List<String> executionPath() {
        synchronized (path) {
            return List.copyOf(path);
        }
    }

    /** Results keyed in the order nodes were entered. */
    public Map<String, NodeExecutionResult> orderedResults() {
        Map<String, NodeExecutionResult> ordered = new LinkedHashMap<>();
        for (String nodeId : executionPath()) {
            NodeExecutionResult result = results.get(nodeId);
            if (result != null) {
                ordered.put(nodeId, result);
            }
        }
        return ordered;
    }
}
