package com.mailflow.mailflow_backend.model.trigger;

public record Sender(String name, String email) {}
