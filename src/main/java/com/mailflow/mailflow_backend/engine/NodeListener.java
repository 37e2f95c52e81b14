package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.model.result.NodeExecutionResult;

/** Observes node progress during a run. */
public interface NodeListener {

    NodeListener NONE = new NodeListener() {};

    default void nodeStarted(String nodeId) {}

    default void nodeCompleted(String nodeId, NodeExecutionResult result) {}
}
