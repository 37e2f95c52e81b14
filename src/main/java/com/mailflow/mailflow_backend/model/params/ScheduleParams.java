package com.mailflow.mailflow_backend.model.params;

import java.util.List;

/**
 * The cron expression is interpreted by whatever fires schedule events; the engine only stores it.
 */
public record ScheduleParams(String cron) implements NodeParameters {

    @Override
    public List<String> validate() {
        return NodeParameters.isBlank(cron) ? List.of("cron is required") : List.of();
    }
}
