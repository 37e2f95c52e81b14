package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.model.domain.ExecutionStatus;
import com.mailflow.mailflow_backend.model.result.NodeExecutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
public class ExecutionEventPublisher {

    // Clients subscribe to /topic/execution/{executionId} for live node updates
    static final String TOPIC = "/topic/execution/";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectProvider<RedisEventBridge> redisBridgeProvider;

    public ExecutionEventPublisher(SimpMessagingTemplate messagingTemplate,
                                   ObjectProvider<RedisEventBridge> redisBridgeProvider) {
        this.messagingTemplate = messagingTemplate;
        this.redisBridgeProvider = redisBridgeProvider;
    }

    public NodeListener listenerFor(UUID executionId) {
        return new NodeListener() {
            @Override
            public void nodeStarted(String nodeId) {
                publishNode(executionId, nodeId, "running", null);
            }

            @Override
            public void nodeCompleted(String nodeId, NodeExecutionResult result) {
                String status;
                if (!result.isExecuted() && result.isPassed()) status = "skipped";
                else if (result.isPassed()) status = "completed";
                else status = "failed";
                publishNode(executionId, nodeId, status, result.getError());
            }
        };
    }

    public void executionFinished(UUID executionId, ExecutionStatus status, String error) {
        publish(executionId, Map.of(
                "executionId", executionId.toString(),
                "status", status.toJson(),
                "error", error != null ? error : ""
        ));
    }

    private void publishNode(UUID executionId, String nodeId, String status, String error) {
        publish(executionId, Map.of(
                "nodeId", nodeId,
                "status", status,
                "error", error != null ? error : ""
        ));
    }

    private void publish(UUID executionId, Map<String, Object> payload) {
        String destination = TOPIC + executionId;
        RedisEventBridge bridge = redisBridgeProvider.getIfAvailable();
        log.debug("[ExecutionEvents] {} -> {} via {}", payload, destination, bridge != null ? "Redis" : "direct");
        if (bridge != null) {
            bridge.publish(destination, payload);
        } else {
            messagingTemplate.convertAndSend(destination, payload);
        }
    }
}
