package com.mailflow.mailflow_backend.mail;

/** Looks up the mail driver for a connection id. */
@FunctionalInterface
public interface MailDriverResolver {

    MailDriver forConnection(String connectionId);
}
