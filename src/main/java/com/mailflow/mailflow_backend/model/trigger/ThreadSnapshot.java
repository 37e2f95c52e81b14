package com.mailflow.mailflow_backend.model.trigger;

import com.mailflow.mailflow_backend.model.domain.LabelInfo;

import java.util.Collections;
import java.util.List;

/**
 * The thread (latest message) an event is about, as the mail sync layer saw it.
 */
public record ThreadSnapshot(
    String id,
    String subject,
    Sender sender,
    List<LabelInfo> labels,
    String receivedOn,
    Boolean unread,
    String body
) {
    public List<LabelInfo> labels() {
        return labels != null ? labels : Collections.emptyList();
    }
}
