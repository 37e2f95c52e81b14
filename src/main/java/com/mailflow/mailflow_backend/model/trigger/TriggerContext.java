package com.mailflow.mailflow_backend.model.trigger;

import java.time.Instant;

/**
 * Snapshot of the event that started a run. labelChange is set only for email_labeled,
 * scheduledTime only for schedule events.
 */
public record TriggerContext(
    TriggerEvent event,
    ThreadSnapshot thread,
    LabelChange labelChange,
    Instant scheduledTime
) {
    public static TriggerContext of(TriggerEvent event, ThreadSnapshot thread, LabelChange labelChange) {
        Instant scheduled = event == TriggerEvent.SCHEDULE ? Instant.now() : null;
        return new TriggerContext(event, thread, labelChange, scheduled);
    }
}
