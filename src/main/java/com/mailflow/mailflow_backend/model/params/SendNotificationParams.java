package com.mailflow.mailflow_backend.model.params;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * provider is one of webhook, slack, telegram. config holds the transport settings:
 * webhook {url, method, headers}, slack {webhookUrl, channel}, telegram {botToken, chatId}.
 */
public record SendNotificationParams(String provider, Map<String, Object> config, String message)
        implements NodeParameters {

    public Map<String, Object> config() {
        return config != null ? config : Collections.emptyMap();
    }

    public String message() {
        return message != null ? message : "";
    }

    public String configValue(String key) {
        Object value = config().get(key);
        return value != null ? value.toString() : null;
    }

    @Override
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (NodeParameters.isBlank(provider)) {
            problems.add("provider is required");
            return problems;
        }
        switch (provider) {
            case "webhook" -> {
                if (NodeParameters.isBlank(configValue("url"))) problems.add("config.url is required");
            }
            case "slack" -> {
                if (NodeParameters.isBlank(configValue("webhookUrl"))) problems.add("config.webhookUrl is required");
            }
            case "telegram" -> {
                if (NodeParameters.isBlank(configValue("botToken"))) problems.add("config.botToken is required");
                if (NodeParameters.isBlank(configValue("chatId"))) problems.add("config.chatId is required");
            }
            default -> problems.add("unknown provider '" + provider + "'");
        }
        return problems;
    }
}
