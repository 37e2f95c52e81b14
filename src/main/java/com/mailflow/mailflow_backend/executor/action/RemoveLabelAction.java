package com.mailflow.mailflow_backend.executor.action;

import com.mailflow.mailflow_backend.executor.ActionContext;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class RemoveLabelAction extends LabelLookupAction {

    @Override
    public NodeType supportedType() {
        return NodeType.REMOVE_LABEL;
    }

    @Override
    protected void apply(ActionContext context, String threadId, String labelId) {
        context.getMailDriver().modifyThread(threadId, List.of(), List.of(labelId));
    }

    @Override
    protected String dryRunVerb() {
        return "remove";
    }
}
