package com.mailflow.mailflow_backend.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What happened to one node during a run. Stored in the execution's node_results column.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeExecutionResult {

    private boolean executed;
    private boolean passed;
    private String  error;

    // Port chosen by a routing condition
    private Integer outputIndex;
    private String  category;

    private ActionResult actionOutput;

    public static NodeExecutionResult skipped() {
        return NodeExecutionResult.builder().executed(false).passed(true).build();
    }

    public static NodeExecutionResult passedThrough() {
        return NodeExecutionResult.builder().executed(true).passed(true).build();
    }

    public static NodeExecutionResult failed(boolean executed, String error) {
        return NodeExecutionResult.builder().executed(executed).passed(false).error(error).build();
    }

    public static NodeExecutionResult fromCondition(ConditionResult result) {
        return NodeExecutionResult.builder()
                .executed(true)
                .passed(result.passed())
                .outputIndex(result.outputIndex())
                .category(result.category())
                .build();
    }

    public static NodeExecutionResult fromAction(ActionResult result) {
        return NodeExecutionResult.builder()
                .executed(true)
                .passed(result.isSuccess())
                .error(result.getError())
                .actionOutput(result)
                .build();
    }
}
