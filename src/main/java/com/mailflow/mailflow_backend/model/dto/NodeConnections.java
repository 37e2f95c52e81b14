package com.mailflow.mailflow_backend.model.dto;

import java.util.Collections;
import java.util.List;

/**
 * Output ports of one source node. Port N is main().get(N); each port lists its targets in order.
 */
public record NodeConnections(List<List<ConnectionTarget>> main) {

    public List<List<ConnectionTarget>> main() {
        return main != null ? main : Collections.emptyList();
    }
}
