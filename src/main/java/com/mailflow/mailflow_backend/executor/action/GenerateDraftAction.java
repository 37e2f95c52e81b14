package com.mailflow.mailflow_backend.executor.action;

import com.mailflow.mailflow_backend.executor.ActionContext;
import com.mailflow.mailflow_backend.executor.ActionHandler;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.params.GenerateDraftParams;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.result.ActionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Extension point for drafting replies with a skill. Real runs always fail for now. */
@Slf4j
@Component
public class GenerateDraftAction implements ActionHandler {

    @Override
    public NodeType supportedType() {
        return NodeType.GENERATE_DRAFT;
    }

    @Override
    public ActionResult execute(ActionContext context, Map<String, Object> parameters) {
        log.info("[GenerateDraft] Not yet implemented");
        return ActionResult.failure("Generate draft action not yet implemented");
    }

    @Override
    public ActionResult dryRun(ActionContext context, Map<String, Object> parameters) {
        GenerateDraftParams params = NodeParameters.read(GenerateDraftParams.class, parameters);
        String skill = params.skillId() != null && !params.skillId().isEmpty() ? params.skillId() : "default";
        return ActionResult.dryRun("Would generate draft using skill: " + skill);
    }
}
