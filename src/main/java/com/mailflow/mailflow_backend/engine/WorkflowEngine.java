package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.executor.MessageInterpolator;
import com.mailflow.mailflow_backend.model.domain.NodeCategory;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.dto.ConnectionTarget;
import com.mailflow.mailflow_backend.model.dto.WorkflowConnections;
import com.mailflow.mailflow_backend.model.dto.WorkflowDefinitionNode;
import com.mailflow.mailflow_backend.model.params.EmptyParams;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.result.ParsedNodeType;
import com.mailflow.mailflow_backend.model.result.ValidationResult;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Static analysis of workflow definitions: node type resolution, execution order and
 * structural validation. Nothing here executes a node or touches storage.
 */
@Component
@RequiredArgsConstructor
public class WorkflowEngine {

    private final MessageInterpolator interpolator;

    /** Unmapped qualified types resolve to category UNKNOWN with the input as type. */
    public ParsedNodeType parseNodeType(String qualifiedType) {
        return NodeType.fromQualifiedName(qualifiedType)
                .map(type -> new ParsedNodeType(type.getCategory(), type.getInternalName()))
                .orElseGet(() -> new ParsedNodeType(NodeCategory.UNKNOWN, qualifiedType));
    }

    /**
     * Kahn's algorithm over enabled nodes. Edges from or to disabled or missing nodes are ignored;
     * nodes on a cycle never reach in-degree zero and are left out.
     */
    public List<String> getExecutionOrder(List<WorkflowDefinitionNode> nodes, WorkflowConnections connections) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (WorkflowDefinitionNode node : nodes) {
            if (isDisabled(node)) continue;
            adjacency.put(node.id(), new ArrayList<>());
            inDegree.put(node.id(), 0);
        }

        for (String sourceId : connections.sourceIds()) {
            if (!adjacency.containsKey(sourceId)) continue;
            for (String target : connections.allTargetsOf(sourceId)) {
                if (!adjacency.containsKey(target)) continue;
                adjacency.get(sourceId).add(target);
                inDegree.merge(target, 1, Integer::sum);
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) queue.add(id);
        });

        List<String> order = new ArrayList<>();
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (String neighbour : adjacency.get(current)) {
                int remaining = inDegree.merge(neighbour, -1, Integer::sum);
                if (remaining == 0) queue.add(neighbour);
            }
        }
        return order;
    }

    public ValidationResult validateWorkflow(List<WorkflowDefinitionNode> nodes, WorkflowConnections connections) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        List<String> triggerIds = nodes.stream()
                .filter(n -> isTriggerNode(n.type()))
                .map(WorkflowDefinitionNode::id)
                .toList();
        if (triggerIds.isEmpty()) {
            errors.add("Workflow must have at least one trigger node");
        }

        for (WorkflowDefinitionNode node : nodes) {
            Optional<NodeType> type = NodeType.fromQualifiedName(node.type());
            if (type.isEmpty()) {
                errors.add("Node '" + node.id() + "' has unknown type '" + node.type() + "'");
                continue;
            }
            parameterProblems(type.get(), node.parameters())
                    .forEach(problem -> errors.add("Node '" + node.id() + "': " + problem));
        }

        Set<String> nodeIds = new HashSet<>();
        nodes.forEach(n -> nodeIds.add(n.id()));

        for (String sourceId : connections.sourceIds()) {
            if (!nodeIds.contains(sourceId)) {
                warnings.add("Connection source '" + sourceId + "' does not exist");
                continue;
            }
            for (String target : connections.allTargetsOf(sourceId)) {
                if (!nodeIds.contains(target)) {
                    errors.add("Connection target '" + target + "' does not exist");
                }
            }
        }

        Set<String> reachable = reachableFrom(triggerIds, connections);
        for (WorkflowDefinitionNode node : nodes) {
            if (isDisabled(node) || isTriggerNode(node.type())) continue;
            if (!reachable.contains(node.id())) {
                errors.add("Node '" + node.id() + "' is orphaned/unreachable");
            }
        }

        return ValidationResult.of(errors, warnings);
    }

    public String interpolateMessage(String template, TriggerData triggerData, Map<String, String> envVars) {
        return interpolator.interpolate(template, triggerData, envVars);
    }

    /** Resolves each qualified type once; the stored node carries category and internal type. */
    public List<WorkflowNode> convertDefinitionToInternal(List<WorkflowDefinitionNode> definitionNodes) {
        return definitionNodes.stream()
                .map(def -> {
                    ParsedNodeType parsed = parseNodeType(def.type());
                    return WorkflowNode.builder()
                            .id(def.id())
                            .category(parsed.category())
                            .nodeType(parsed.type())
                            .name(def.name() != null && !def.name().isEmpty() ? def.name() : def.id())
                            .position(def.position())
                            .parameters(def.parameters() != null ? new LinkedHashMap<>(def.parameters()) : new LinkedHashMap<>())
                            .disabled(Boolean.TRUE.equals(def.disabled()))
                            .build();
                })
                .toList();
    }

    public boolean isTriggerNode(String qualifiedType) {
        return parseNodeType(qualifiedType).category() == NodeCategory.TRIGGER;
    }

    public boolean isConditionNode(String qualifiedType) {
        return parseNodeType(qualifiedType).category() == NodeCategory.CONDITION;
    }

    public boolean isActionNode(String qualifiedType) {
        return parseNodeType(qualifiedType).category() == NodeCategory.ACTION;
    }

    /** Every node reachable forward from nodeId over any port, in discovery order. */
    public List<String> getDownstreamNodes(String nodeId, WorkflowConnections connections, Set<String> allNodeIds) {
        List<String> downstream = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(nodeId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) continue;
            for (String target : connections.allTargetsOf(current)) {
                if (allNodeIds.contains(target) && !visited.contains(target)) {
                    downstream.add(target);
                    queue.add(target);
                }
            }
        }
        return downstream;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Set<String> reachableFrom(List<String> startIds, WorkflowConnections connections) {
        Set<String> reachable = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(startIds);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!reachable.add(current)) continue;
            connections.outputsOf(current).stream()
                    .filter(Objects::nonNull)
                    .flatMap(List::stream)
                    .filter(Objects::nonNull)
                    .map(ConnectionTarget::node)
                    .filter(target -> !reachable.contains(target))
                    .forEach(queue::add);
        }
        return reachable;
    }

    private List<String> parameterProblems(NodeType type, Map<String, Object> parameters) {
        if (type.getParametersType() == EmptyParams.class) {
            return List.of();
        }
        try {
            return NodeParameters.read(type.getParametersType(), parameters).validate();
        } catch (IllegalArgumentException e) {
            return List.of("invalid parameters (" + e.getMessage() + ")");
        }
    }

    private static boolean isDisabled(WorkflowDefinitionNode node) {
        return Boolean.TRUE.equals(node.disabled());
    }
}
