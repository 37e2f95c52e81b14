package com.mailflow.mailflow_backend.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionResult {

    private boolean success;
    private String  error;
    private Object  output;
    private Boolean dryRun;

    public static ActionResult ok() {
        return ActionResult.builder().success(true).build();
    }

    public static ActionResult ok(Object output) {
        return ActionResult.builder().success(true).output(output).build();
    }

    public static ActionResult failure(String error) {
        return ActionResult.builder().success(false).error(error).build();
    }

    /** What the action would have done, reported without touching anything. */
    public static ActionResult dryRun(Object output) {
        return ActionResult.builder().success(true).dryRun(true).output(output).build();
    }
}
