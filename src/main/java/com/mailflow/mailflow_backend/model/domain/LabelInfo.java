package com.mailflow.mailflow_backend.model.domain;

/** A mailbox label as the mail provider reports it. */
public record LabelInfo(String id, String name) {}
