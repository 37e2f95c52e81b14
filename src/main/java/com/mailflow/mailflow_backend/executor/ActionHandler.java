package com.mailflow.mailflow_backend.executor;

import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.result.ActionResult;

import java.util.Map;

/**
 * One action kind. execute() may throw; ActionExecutor turns exceptions into failed results.
 * dryRun() must not touch the mailbox or the network.
 */
public interface ActionHandler {

    NodeType supportedType();

    ActionResult execute(ActionContext context, Map<String, Object> parameters);

    ActionResult dryRun(ActionContext context, Map<String, Object> parameters);
}
