package com.mailflow.mailflow_backend.executor.action;

import com.mailflow.mailflow_backend.mail.MailDriver;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MarkUnreadAction extends LabelToggleAction {

    public MarkUnreadAction() {
        super(List.of(MailDriver.LABEL_UNREAD), List.of(), "Would mark as unread");
    }

    @Override
    public NodeType supportedType() {
        return NodeType.MARK_UNREAD;
    }
}
