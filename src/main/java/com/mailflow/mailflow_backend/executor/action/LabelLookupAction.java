package com.mailflow.mailflow_backend.executor.action;

import com.mailflow.mailflow_backend.executor.ActionContext;
import com.mailflow.mailflow_backend.executor.ActionHandler;
import com.mailflow.mailflow_backend.model.domain.LabelInfo;
import com.mailflow.mailflow_backend.model.params.LabelParams;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.result.ActionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Base for add_label and remove_label. The configured label name is resolved to the
 * provider's label id (case-insensitive) before the thread is modified.
 */
@Slf4j
public abstract class LabelLookupAction implements ActionHandler {

    protected abstract void apply(ActionContext context, String threadId, String labelId);

    protected abstract String dryRunVerb();

    @Override
    public ActionResult execute(ActionContext context, Map<String, Object> parameters) {
        LabelParams params = NodeParameters.read(LabelParams.class, parameters);
        if (params.label() == null) {
            return ActionResult.failure("Label is required");
        }

        Optional<LabelInfo> label = context.getMailDriver().getLabels().stream()
                .filter(l -> l.name() != null && l.name().equalsIgnoreCase(params.label()))
                .findFirst();
        if (label.isEmpty()) {
            log.warn("[ActionExecutor] {}: label '{}' not found", supportedType().getInternalName(), params.label());
            return ActionResult.failure("Label '" + params.label() + "' not found");
        }

        String threadId = context.getTriggerData().threadId();
        log.info("[ActionExecutor] {}: threadId={}, labelId={}", supportedType().getInternalName(), threadId, label.get().id());
        apply(context, threadId, label.get().id());
        return ActionResult.ok(Map.of("labelId", label.get().id()));
    }

    @Override
    public ActionResult dryRun(ActionContext context, Map<String, Object> parameters) {
        LabelParams params = NodeParameters.read(LabelParams.class, parameters);
        return ActionResult.dryRun("Would " + dryRunVerb() + " label: " + params.label());
    }
}
