package com.mailflow.mailflow_backend.executor;

import com.mailflow.mailflow_backend.mail.MailDriver;
import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Everything an action needs: the thread it acts on, the mailbox driver, and template variables.
 */
@Value
@Builder(toBuilder = true)
public class ActionContext {

    String connectionId;
    TriggerData triggerData;
    boolean dryRun;
    @Builder.Default
    Map<String, String> envVars = Map.of();
    MailDriver mailDriver;
}
