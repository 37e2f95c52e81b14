package com.mailflow.mailflow_backend.model.dto;

/** One edge end: the target node id and the input slot it lands on. */
public record ConnectionTarget(String node, int index) {}
