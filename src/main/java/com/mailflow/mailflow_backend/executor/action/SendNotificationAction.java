package com.mailflow.mailflow_backend.executor.action;

import com.mailflow.mailflow_backend.config.MailflowProperties;
import com.mailflow.mailflow_backend.executor.ActionContext;
import com.mailflow.mailflow_backend.executor.ActionHandler;
import com.mailflow.mailflow_backend.executor.MessageInterpolator;
import com.mailflow.mailflow_backend.model.domain.NodeType;
import com.mailflow.mailflow_backend.model.params.NodeParameters;
import com.mailflow.mailflow_backend.model.params.SendNotificationParams;
import com.mailflow.mailflow_backend.model.result.ActionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * send_notification: posts the interpolated message to a webhook, a Slack incoming webhook
 * or the Telegram Bot API. A non-2xx answer is a failed result, never an exception.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SendNotificationAction implements ActionHandler {

    private final RestTemplate        restTemplate;
    private final MessageInterpolator interpolator;
    private final MailflowProperties  properties;

    @Override
    public NodeType supportedType() {
        return NodeType.SEND_NOTIFICATION;
    }

    @Override
    public ActionResult dryRun(ActionContext context, Map<String, Object> parameters) {
        SendNotificationParams params = NodeParameters.read(SendNotificationParams.class, parameters);
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("provider", params.provider());
        output.put("message", render(context, params));
        return ActionResult.dryRun(output);
    }

    @Override
    public ActionResult execute(ActionContext context, Map<String, Object> parameters) {
        SendNotificationParams params = NodeParameters.read(SendNotificationParams.class, parameters);
        String message = render(context, params);
        String provider = params.provider() != null ? params.provider() : "";

        return switch (provider) {
            case "webhook"  -> sendWebhook(context, params, message);
            case "slack"    -> sendSlack(params, message);
            case "telegram" -> sendTelegram(params, message);
            default         -> ActionResult.failure("Unknown notification provider: " + params.provider());
        };
    }

    private String render(ActionContext context, SendNotificationParams params) {
        return interpolator.interpolate(params.message(), context.getTriggerData(), context.getEnvVars());
    }

    // ── Transports ───────────────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private ActionResult sendWebhook(ActionContext context, SendNotificationParams params, String message) {
        String url = params.configValue("url");
        String method = params.configValue("method") != null ? params.configValue("method").toUpperCase() : "POST";

        HttpHeaders headers = jsonHeaders();
        Object extraHeaders = params.config().get("headers");
        if (extraHeaders instanceof Map<?, ?> map) {
            ((Map<String, Object>) map).forEach((k, v) -> headers.set(k, String.valueOf(v)));
        }

        Map<String, Object> body = null;
        if (!"GET".equals(method)) {
            body = new LinkedHashMap<>();
            body.put("message", message);
            body.put("trigger", context.getTriggerData());
        }

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, HttpMethod.valueOf(method), new HttpEntity<>(body, headers), String.class);
            int status = response.getStatusCode().value();
            if (!response.getStatusCode().is2xxSuccessful()) {
                return ActionResult.failure("Webhook failed: " + status);
            }
            log.info("[SendNotification] webhook {} {} -> {}", method, url, status);
            return ActionResult.ok(Map.of("status", status));
        } catch (HttpStatusCodeException ex) {
            log.warn("[SendNotification] webhook {} {} -> {}", method, url, ex.getStatusCode().value());
            return ActionResult.failure("Webhook failed: " + ex.getStatusCode().value() + " " + ex.getStatusText());
        }
    }

    private ActionResult sendSlack(SendNotificationParams params, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", message);
        body.put("channel", params.configValue("channel"));

        Integer status = post(params.configValue("webhookUrl"), body);
        return status == null ? ActionResult.ok() : ActionResult.failure("Slack notification failed: " + status);
    }

    private ActionResult sendTelegram(SendNotificationParams params, String message) {
        String url = properties.getNotifications().getTelegramBaseUrl()
                + "/bot" + params.configValue("botToken") + "/sendMessage";
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", params.configValue("chatId"));
        body.put("text", message);

        Integer status = post(url, body);
        return status == null ? ActionResult.ok() : ActionResult.failure("Telegram notification failed: " + status);
    }

    /** POSTs JSON; returns null on 2xx, otherwise the status code. */
    private Integer post(String url, Map<String, Object> body) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(body, jsonHeaders()), String.class);
            return response.getStatusCode().is2xxSuccessful() ? null : response.getStatusCode().value();
        } catch (HttpStatusCodeException ex) {
            log.warn("[SendNotification] POST failed with {}", ex.getStatusCode().value());
            return ex.getStatusCode().value();
        }
    }

    private static HttpHeaders jsonHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return headers;
    }
}
