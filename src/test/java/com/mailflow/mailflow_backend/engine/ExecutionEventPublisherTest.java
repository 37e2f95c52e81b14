package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.model.domain.ExecutionStatus;
import com.mailflow.mailflow_backend.model.result.NodeExecutionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionEventPublisherTest {

    private static final UUID EXECUTION_ID = UUID.randomUUID();
    private static final String DESTINATION = "/topic/execution/" + EXECUTION_ID;

    @Mock private SimpMessagingTemplate messagingTemplate;
    @Mock private ObjectProvider<RedisEventBridge> bridgeProvider;
    @Mock private RedisEventBridge bridge;

    @Test
    void nodeProgressGoesStraightToStompWithoutABridge() {
        when(bridgeProvider.getIfAvailable()).thenReturn(null);
        NodeListener listener = new ExecutionEventPublisher(messagingTemplate, bridgeProvider).listenerFor(EXECUTION_ID);

        listener.nodeStarted("c");
        listener.nodeCompleted("c", NodeExecutionResult.failed(true, "Invalid pattern"));
        listener.nodeCompleted("d", NodeExecutionResult.skipped());
        listener.nodeCompleted("t", NodeExecutionResult.passedThrough());

        verify(messagingTemplate).convertAndSend(DESTINATION, (Object) Map.of("nodeId", "c", "status", "running", "error", ""));
        verify(messagingTemplate).convertAndSend(DESTINATION, (Object) Map.of("nodeId", "c", "status", "failed", "error", "Invalid pattern"));
        verify(messagingTemplate).convertAndSend(DESTINATION, (Object) Map.of("nodeId", "d", "status", "skipped", "error", ""));
        verify(messagingTemplate).convertAndSend(DESTINATION, (Object) Map.of("nodeId", "t", "status", "completed", "error", ""));
    }

    @Test
    void bridgeTakesOverWhenPresent() {
        when(bridgeProvider.getIfAvailable()).thenReturn(bridge);

        new ExecutionEventPublisher(messagingTemplate, bridgeProvider)
                .executionFinished(EXECUTION_ID, ExecutionStatus.COMPLETED, null);

        verify(bridge).publish(DESTINATION, Map.of(
                "executionId", EXECUTION_ID.toString(), "status", "completed", "error", ""));
        verify(messagingTemplate, never()).convertAndSend(anyString(), any(Object.class));
    }
}
