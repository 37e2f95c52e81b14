package com.mailflow.mailflow_backend.model.dto;

import com.mailflow.mailflow_backend.model.trigger.LabelChange;
import com.mailflow.mailflow_backend.model.trigger.ThreadSnapshot;
import com.mailflow.mailflow_backend.model.trigger.TriggerEvent;

/**
 * Request body for POST /api/workflows/events, sent by the mail sync layer.
 */
public record MailEventRequest(
    String userId,
    String connectionId,
    TriggerEvent event,
    ThreadSnapshot thread,
    LabelChange labelChange
) {}
