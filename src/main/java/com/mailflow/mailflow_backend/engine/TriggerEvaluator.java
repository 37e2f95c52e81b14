package com.mailflow.mailflow_backend.engine;

import com.mailflow.mailflow_backend.model.domain.LabelInfo;
import com.mailflow.mailflow_backend.model.domain.NodeCategory;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.domain.WorkflowNode;
import com.mailflow.mailflow_backend.model.params.EmailLabeledParams;
import com.mailflow.mailflow_backend.model.params.EmailReceivedParams;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.result.TriggerEvaluationResult;
import com.mailflow.mailflow_backend.model.trigger.LabelChange;
import com.mailflow.mailflow_backend.model.trigger.ThreadSnapshot;
import com.mailflow.mailflow_backend.model.trigger.TriggerContext;
import com.mailflow.mailflow_backend.model.trigger.TriggerEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a trigger node fires for an incoming event. Stateless.
 */
@Slf4j
@Component
public class TriggerEvaluator {

    private static final Map<NodeType, TriggerEvent> EVENT_BY_TRIGGER = Map.of(
            NodeType.EMAIL_RECEIVED, TriggerEvent.EMAIL_RECEIVED,
            NodeType.EMAIL_LABELED,  TriggerEvent.EMAIL_LABELED,
            NodeType.SCHEDULE,       TriggerEvent.SCHEDULE
    );

    public boolean evaluate(WorkflowNode triggerNode, TriggerContext context) {
        if (triggerNode.isDisabled() || triggerNode.getCategory() != NodeCategory.TRIGGER) {
            return false;
        }

        Optional<NodeType> type = triggerNode.resolvedType();
        if (type.isEmpty() || !EVENT_BY_TRIGGER.containsKey(type.get())) {
            log.warn("[TriggerEvaluator] Unknown trigger type: {}", triggerNode.getNodeType());
            return false;
        }
        if (EVENT_BY_TRIGGER.get(type.get()) != context.event()) {
            return false;
        }

        return switch (type.get()) {
            case EMAIL_RECEIVED -> matchesReceived(triggerNode, context);
            case EMAIL_LABELED  -> matchesLabeled(triggerNode, context);
            case SCHEDULE       -> context.event() == TriggerEvent.SCHEDULE;
            default             -> false;
        };
    }

    /** First trigger that fires wins. */
    public TriggerEvaluationResult evaluateWorkflow(List<WorkflowNode> triggerNodes, TriggerContext context) {
        for (WorkflowNode trigger : triggerNodes) {
            if (evaluate(trigger, context)) {
                return TriggerEvaluationResult.matched(trigger.getId());
            }
        }
        return TriggerEvaluationResult.none();
    }

    public static TriggerContext buildTriggerContext(TriggerEvent event, ThreadSnapshot thread, LabelChange labelChange) {
        return TriggerContext.of(event, thread, labelChange);
    }

    private boolean matchesReceived(WorkflowNode node, TriggerContext context) {
        String folder = NodeParameters.read(EmailReceivedParams.class, node.getParameters()).folder();
        if (folder == null || folder.isEmpty()) {
            return true;
        }
        if (context.thread() == null) {
            return false;
        }
        for (LabelInfo label : context.thread().labels()) {
            if (folder.equalsIgnoreCase(label.id()) || folder.equalsIgnoreCase(label.name())) {
                return true;
            }
        }
        return false;
    }

    // Label names compare exactly; the mail sync layer reports them as the user typed them
    private boolean matchesLabeled(WorkflowNode node, TriggerContext context) {
        LabelChange change = context.labelChange();
        if (change == null) {
            return false;
        }
        EmailLabeledParams params = NodeParameters.read(EmailLabeledParams.class, node.getParameters());
        if (params.label() != null && !params.label().equals(change.label())) {
            return false;
        }
        if (params.action() != null) {
            String action = change.action() != null ? change.action().toJson() : null;
            return params.action().equals(action);
        }
        return true;
    }
}
