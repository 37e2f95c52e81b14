package com.mailflow.mailflow_backend.model.result;

import com.mailflow.mailflow_backend.model.domain.NodeCategory;

/** Category and internal type name a qualified node type resolves to. */
public record ParsedNodeType(NodeCategory category, String type) {}
