package com.mailflow.mailflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Source node id to output ports. Serialises as a plain JSON object:
 * {"trigger-1": {"main": [[{"node": "cond-1", "index": 0}]]}}
 */
public class WorkflowConnections {

    private final Map<String, NodeConnections> bySource = new LinkedHashMap<>();

    public WorkflowConnections() {}

    public WorkflowConnections(Map<String, NodeConnections> connections) {
        if (connections != null) {
            bySource.putAll(connections);
        }
    }

    @JsonAnySetter
    public void put(String sourceId, NodeConnections outputs) {
        bySource.put(sourceId, outputs);
    }

    @JsonAnyGetter
    public Map<String, NodeConnections> asMap() {
        return bySource;
    }

    /** Adds sourceId[port] -> target, growing the port list as needed. Returns this for chaining. */
    public WorkflowConnections connect(String sourceId, int port, String targetId) {
        List<List<ConnectionTarget>> ports = new ArrayList<>();
        NodeConnections existing = bySource.get(sourceId);
        if (existing != null) {
            existing.main().forEach(p -> ports.add(new ArrayList<>(p)));
        }
        while (ports.size() <= port) {
            ports.add(new ArrayList<>());
        }
        ports.get(port).add(new ConnectionTarget(targetId, 0));
        bySource.put(sourceId, new NodeConnections(ports));
        return this;
    }

    @JsonIgnore
    public Set<String> sourceIds() {
        return Collections.unmodifiableSet(bySource.keySet());
    }

    /** All ports of a source; empty when the node has no outgoing connections. */
    public List<List<ConnectionTarget>> outputsOf(String sourceId) {
        NodeConnections outputs = bySource.get(sourceId);
        return outputs != null ? outputs.main() : Collections.emptyList();
    }

    /** Target ids of one port; empty when the port does not exist. */
    public List<String> targetsOf(String sourceId, int port) {
        List<List<ConnectionTarget>> ports = outputsOf(sourceId);
        if (port < 0 || port >= ports.size() || ports.get(port) == null) {
            return Collections.emptyList();
        }
        return ports.get(port).stream()
                .filter(Objects::nonNull)
                .map(ConnectionTarget::node)
                .toList();
    }

    /** Every target id of every port, in port order. */
    public List<String> allTargetsOf(String sourceId) {
        List<String> targets = new ArrayList<>();
        for (List<ConnectionTarget> port : outputsOf(sourceId)) {
            if (port == null) continue;
            port.stream().filter(Objects::nonNull).map(ConnectionTarget::node).forEach(targets::add);
        }
        return targets;
    }
}
