package com.mailflow.mailflow_backend.executor.action;

import com.mailflow.mailflow_backend.executor.ActionContext;
import com.mailflow.mailflow_backend.executor.ActionHandler;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.params.RunSkillParams;
import com.mailflow.mailflow_backend.model.result.ActionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
public class RunSkillAction implements ActionHandler {

    @Override
    public NodeType supportedType() {
        return NodeType.RUN_SKILL;
    }

    @Override
    public ActionResult execute(ActionContext context, Map<String, Object> parameters) {
        RunSkillParams params = NodeParameters.read(RunSkillParams.class, parameters);
        log.info("[RunSkill] Not yet implemented: {}", params.skillId());
        return ActionResult.failure("Run skill action not yet implemented");
    }

    @Override
    public ActionResult dryRun(ActionContext context, Map<String, Object> parameters) {
        RunSkillParams params = NodeParameters.read(RunSkillParams.class, parameters);
        return ActionResult.dryRun("Would run skill: " + params.skillId());
    }
}
