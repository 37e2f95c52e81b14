package com.mailflow.mailflow_backend.executor;

import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;

import java.util.Map;

/**
 * A synchronous pass/fail condition. Missing input data evaluates to false rather than throwing.
 */
public interface ConditionHandler {

    NodeType supportedType();

    boolean evaluate(TriggerData triggerData, Map<String, Object> parameters);
}
