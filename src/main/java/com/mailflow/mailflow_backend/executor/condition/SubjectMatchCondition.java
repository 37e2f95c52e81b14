package com.mailflow.mailflow_backend.executor.condition;

import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import org.springframework.stereotype.Component;

@Component
public class SubjectMatchCondition extends GlobMatchCondition {

    @Override
    public NodeType supportedType() {
        return NodeType.SUBJECT_MATCH;
    }

    @Override
    protected String fieldValue(TriggerData triggerData) {
        return triggerData.subject();
    }
}
