package com.mailflow.mailflow_backend.mail;

import com.mailflow.mailflow_backend.model.domain.LabelInfo;

import java.util.List;

/**
 * Stand-in driver for runs that must never reach the mailbox, such as dry runs without a connection.
 */
public class UnavailableMailDriver implements MailDriver {

    private final String reason;

    public UnavailableMailDriver(String reason) {
        this.reason = reason;
    }

    @Override
    public void modifyThread(String threadId, List<String> addLabels, List<String> removeLabels) {
        throw new IllegalStateException(reason);
    }

    @Override
    public List<LabelInfo> getLabels() {
        throw new IllegalStateException(reason);
    }
}
