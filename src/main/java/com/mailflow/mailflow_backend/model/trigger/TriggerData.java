package com.mailflow.mailflow_backend.model.trigger;

import com.mailflow.mailflow_backend.model.domain.LabelInfo;
import lombok.Builder;

import java.util.Collections;
import java.util.List;

/**
 * Flattened view of a trigger context that conditions, actions and message templates read.
 */
@Builder
public record TriggerData(
    String threadId,
    String messageId,
    String subject,
    String sender,
    List<String> recipients,
    List<String> labels,
    String receivedAt,
    String snippet
) {
    public List<String> labels() {
        return labels != null ? labels : Collections.emptyList();
    }

    public List<String> recipients() {
        return recipients != null ? recipients : Collections.emptyList();
    }

    public static TriggerData from(TriggerContext context) {
        if (context == null || context.thread() == null) {
            return TriggerData.builder().build();
        }
        ThreadSnapshot thread = context.thread();
        return TriggerData.builder()
                .threadId(thread.id())
                .messageId(thread.id())
                .subject(thread.subject())
                .sender(thread.sender() != null ? thread.sender().email() : null)
                .recipients(Collections.emptyList())
                .labels(thread.labels().stream().map(LabelInfo::id).toList())
                .receivedAt(thread.receivedOn())
                .snippet(thread.body())
                .build();
    }

    /** Value of a named field for {{$trigger.x}} templates; null when the field is unknown. */
    public String field(String name) {
        return switch (name) {
            case "threadId"   -> threadId;
            case "messageId"  -> messageId;
            case "subject"    -> subject;
            case "sender"     -> sender;
            case "recipients" -> String.join(",", recipients());
            case "labels"     -> String.join(",", labels());
            case "receivedAt" -> receivedAt;
            case "snippet"    -> snippet;
            default           -> null;
        };
    }
}
