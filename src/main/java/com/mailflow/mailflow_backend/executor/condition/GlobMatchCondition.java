package com.mailflow.mailflow_backend.executor.condition;

import com.mailflow.mailflow_backend.executor.ConditionHandler;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.params.PatternParams;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;

import java.util.Map;

/**
 * Base for conditions that match one trigger field against a glob pattern.
 */
public abstract class GlobMatchCondition implements ConditionHandler {

    protected abstract String fieldValue(TriggerData triggerData);

    @Override
    public boolean evaluate(TriggerData triggerData, Map<String, Object> parameters) {
        String value = fieldValue(triggerData);
        if (value == null || value.isEmpty()) return false;

        PatternParams params = NodeParameters.read(PatternParams.class, parameters);
        if (params.pattern() == null) return false;

        return GlobPattern.matches(params.pattern(), value);
    }
}
