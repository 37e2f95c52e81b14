package com.mailflow.mailflow_backend.model.params;

public record GenerateDraftParams(String skillId, String instructions) implements NodeParameters {}
