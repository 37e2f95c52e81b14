package com.mailflow.mailflow_backend.mail;

import com.mailflow.mailflow_backend.model.domain.LabelInfo;

import java.util.List;

/**
 * Label operations on one mail connection. Implementations talk to the mail provider;
 * any exception they throw becomes a failed action result.
 */
public interface MailDriver {

    String LABEL_UNREAD = "UNREAD";
    String LABEL_INBOX  = "INBOX";

    void modifyThread(String threadId, List<String> addLabels, List<String> removeLabels);

    List<LabelInfo> getLabels();
}
