package com.mailflow.mailflow_backend.executor.condition;

import com.mailflow.mailflow_backend.executor.ConditionHandler;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.params.LabelMatchParams;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * label_match: case-insensitive membership of the configured labels in the thread's labels.
 * mode "any" (default) needs one of them, "all" needs every one.
 */
@Component
public class LabelMatchCondition implements ConditionHandler {

    @Override
    public NodeType supportedType() {
        return NodeType.LABEL_MATCH;
    }

    @Override
    public boolean evaluate(TriggerData triggerData, Map<String, Object> parameters) {
        if (triggerData.labels().isEmpty()) return false;

        LabelMatchParams params = NodeParameters.read(LabelMatchParams.class, parameters);
        if (params.labels() == null) return false;

        Set<String> threadLabels = triggerData.labels().stream()
                .map(String::toLowerCase)
                .collect(Collectors.toSet());

        if (LabelMatchParams.MODE_ALL.equals(params.mode())) {
            return params.labels().stream().allMatch(l -> threadLabels.contains(l.toLowerCase()));
        }
        return params.labels().stream().anyMatch(l -> threadLabels.contains(l.toLowerCase()));
    }
}
