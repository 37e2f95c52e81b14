package com.mailflow.mailflow_backend.executor.condition;

import com.mailflow.mailflow_backend.executor.ConditionHandler;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.params.KeywordMatchParams;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * keyword_match: any keyword appears (case-insensitive substring) in the subject, the body snippet, or both.
 */
@Component
public class KeywordMatchCondition implements ConditionHandler {

    @Override
    public NodeType supportedType() {
        return NodeType.KEYWORD_MATCH;
    }

    @Override
    public boolean evaluate(TriggerData triggerData, Map<String, Object> parameters) {
        KeywordMatchParams params = NodeParameters.read(KeywordMatchParams.class, parameters);
        if (params.keywords() == null) return false;

        StringBuilder searchText = new StringBuilder();
        if (params.searchesSubject()) {
            searchText.append(lower(triggerData.subject())).append(' ');
        }
        if (params.searchesBody()) {
            searchText.append(lower(triggerData.snippet()));
        }

        String haystack = searchText.toString();
        return params.keywords().stream()
                .filter(k -> k != null)
                .anyMatch(k -> haystack.contains(k.toLowerCase()));
    }

    private static String lower(String value) {
        return value != null ? value.toLowerCase() : "";
    }
}
