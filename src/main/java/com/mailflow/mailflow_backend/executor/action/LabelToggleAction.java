package com.mailflow.mailflow_backend.executor.action;

import com.mailflow.mailflow_backend.executor.ActionContext;
import com.mailflow.mailflow_backend.executor.ActionHandler;
import com.mailflow.mailflow_backend.model.result.ActionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

/**
 * Base for actions that add or remove one well-known system label on the thread.
 */
@Slf4j
public abstract class LabelToggleAction implements ActionHandler {

    private final List<String> addLabels;
    private final List<String> removeLabels;
    private final String dryRunDescription;

    protected LabelToggleAction(List<String> addLabels, List<String> removeLabels, String dryRunDescription) {
        this.addLabels = addLabels;
        this.removeLabels = removeLabels;
        this.dryRunDescription = dryRunDescription;
    }

    @Override
    public ActionResult execute(ActionContext context, Map<String, Object> parameters) {
        String threadId = context.getTriggerData().threadId();
        log.info("[ActionExecutor] {}: threadId={}", supportedType().getInternalName(), threadId);
        context.getMailDriver().modifyThread(threadId, addLabels, removeLabels);
        return ActionResult.ok();
    }

    @Override
    public ActionResult dryRun(ActionContext context, Map<String, Object> parameters) {
        return ActionResult.dryRun(dryRunDescription);
    }
}
