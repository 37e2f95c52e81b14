package com.mailflow.mailflow_backend.executor.action;

import com.mailflow.mailflow_backend.mail.MailDriver;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MarkReadAction extends LabelToggleAction {

    public MarkReadAction() {
        super(List.of(), List.of(MailDriver.LABEL_UNREAD), "Would mark as read");
    }

    @Override
    public NodeType supportedType() {
        return NodeType.MARK_READ;
    }
}
