package com.mailflow.mailflow_backend.executor.action;

import com.mailflow.mailflow_backend.mail.MailDriver;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import org.springframework.stereotype.Component;

import java.util.List;

/** Archiving is removing the thread from INBOX. */
@Component
public class ArchiveAction extends LabelToggleAction {

    public ArchiveAction() {
        super(List.of(), List.of(MailDriver.LABEL_INBOX), "Would archive");
    }

    @Override
    public NodeType supportedType() {
        return NodeType.ARCHIVE;
    }
}
