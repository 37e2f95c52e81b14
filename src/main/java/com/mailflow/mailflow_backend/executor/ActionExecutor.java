package com.mailflow.mailflow_backend.executor;

import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.result.ActionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs action nodes. Never throws: unknown types, handler exceptions and provider errors
 * all come back as a failed ActionResult. In dry-run mode no handler side effect happens.
 */
@Slf4j
@Component
public class ActionExecutor {

    private final Map<NodeType, ActionHandler> registry = new EnumMap<>(NodeType.class);

    public ActionExecutor(List<ActionHandler> handlers) {
        handlers.forEach(handler -> registry.put(handler.supportedType(), handler));
    }

    public ActionResult execute(String actionType, ActionContext context, Map<String, Object> parameters) {
        ActionHandler handler = NodeType.fromInternalName(actionType).map(registry::get).orElse(null);
        if (handler == null) {
            log.warn("[ActionExecutor] Unknown action type: {}", actionType);
            return ActionResult.failure("Unknown action type: " + actionType);
        }

        try {
            return context.isDryRun()
                    ? handler.dryRun(context, parameters)
                    : handler.execute(context, parameters);
        } catch (Exception ex) {
            String msg = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.warn("[ActionExecutor] {} failed: {}", actionType, msg);
            return ActionResult.failure(msg);
        }
    }
}
