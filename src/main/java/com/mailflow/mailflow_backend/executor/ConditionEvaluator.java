package com.mailflow.mailflow_backend.executor;

import com.mailflow.mailflow_backend.executor.condition.AiClassificationCondition;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.params.AiClassificationParams;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.result.ConditionResult;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatches condition nodes by their internal type name.
 *
 * evaluate() covers the synchronous pass/fail conditions only. evaluateAsync() also handles
 * ai_classification and reports which output port the walk should follow.
 */
@Slf4j
@Component
public class ConditionEvaluator {

    private final Map<NodeType, ConditionHandler> registry = new EnumMap<>(NodeType.class);
    private final AiClassificationCondition aiClassification;

    public ConditionEvaluator(List<ConditionHandler> handlers, AiClassificationCondition aiClassification) {
        handlers.forEach(handler -> registry.put(handler.supportedType(), handler));
        this.aiClassification = aiClassification;
    }

    public boolean evaluate(String conditionType, TriggerData triggerData, Map<String, Object> parameters) {
        Optional<ConditionHandler> handler = NodeType.fromInternalName(conditionType).map(registry::get);
        if (handler.isEmpty()) {
            log.warn("[ConditionEvaluator] Unknown condition type: {}", conditionType);
            return false;
        }
        return handler.get().evaluate(triggerData, parameters);
    }

    /**
     * Completes exceptionally only when a synchronous condition throws (bad parameters, invalid pattern).
     * ai_classification never fails; its errors route to "other".
     */
    public CompletableFuture<ConditionResult> evaluateAsync(String conditionType,
                                                            TriggerData triggerData,
                                                            Map<String, Object> parameters,
                                                            String userId) {
        if (NodeType.AI_CLASSIFICATION.getInternalName().equals(conditionType)) {
            AiClassificationParams params;
            try {
                params = NodeParameters.read(AiClassificationParams.class, parameters);
            } catch (IllegalArgumentException e) {
                log.warn("[AIClassification] Unreadable parameters, routing to \"other\": {}", e.getMessage());
                params = new AiClassificationParams(List.of());
            }
            return aiClassification.classify(triggerData, params, userId);
        }

        try {
            return CompletableFuture.completedFuture(
                    ConditionResult.ofBoolean(evaluate(conditionType, triggerData, parameters)));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
