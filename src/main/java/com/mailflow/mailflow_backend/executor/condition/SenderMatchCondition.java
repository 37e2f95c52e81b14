package com.mailflow.mailflow_backend.executor.condition;

import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import org.springframework.stereotype.Component;

/** sender_match: glob against the sender email address, e.g. "*@example.com". */
@Component
public class SenderMatchCondition extends GlobMatchCondition {

    @Override
    public NodeType supportedType() {
        return NodeType.SENDER_MATCH;
    }

    @Override
    protected String fieldValue(TriggerData triggerData) {
        return triggerData.sender();
    }
}
