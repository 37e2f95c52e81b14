package com.mailflow.mailflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One step of a workflow graph as stored on the workflow row.
 * The category travels under the JSON key "type" so stored definitions stay readable by the editor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowNode {

    private String id;

    @JsonProperty("type")
    private NodeCategory category;

    // Internal subtype name, e.g. "sender_match"
    private String nodeType;

    private String name;

    private List<Double> position;

    private Map<String, Object> parameters;

    private boolean disabled;

    public Map<String, Object> getParameters() {
        return parameters != null ? parameters : Map.of();
    }

    @JsonIgnore
    public Optional<NodeType> resolvedType() {
        return NodeType.fromInternalName(nodeType)
                .filter(type -> category == null || type.getCategory() == category);
    }
}
