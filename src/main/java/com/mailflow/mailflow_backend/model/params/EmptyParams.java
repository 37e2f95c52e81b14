package com.mailflow.mailflow_backend.model.params;

/** Parameters of node kinds that take none (mark_read, mark_unread, archive). */
public record EmptyParams() implements NodeParameters {}
