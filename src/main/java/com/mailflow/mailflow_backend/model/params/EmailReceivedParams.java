package com.mailflow.mailflow_backend.model.params;

/** folder is optional; absent means every incoming email matches. */
public record EmailReceivedParams(String folder) implements NodeParameters {}
