package com.mailflow.mailflow_backend.executor;

import com.mailflow.mailflow_backend.model.trigger.TriggerData;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {{$trigger.field}} and {{$env.NAME}} tokens in notification templates.
 * Unknown sources, unknown fields and missing variables render as an empty string.
 */
@Component
public class MessageInterpolator {

    private static final Pattern TOKEN = Pattern.compile("\\{\\{\\$(\\w+)\\.(\\w+)}}");

    public String interpolate(String template, TriggerData triggerData, Map<String, String> envVars) {
        if (template == null || !template.contains("{{")) return template;

        Matcher matcher = TOKEN.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = lookup(matcher.group(1), matcher.group(2), triggerData, envVars);
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private String lookup(String source, String field, TriggerData triggerData, Map<String, String> envVars) {
        switch (source) {
            case "trigger" -> {
                String value = triggerData != null ? triggerData.field(field) : null;
                return value != null ? value : "";
            }
            case "env" -> {
                String value = envVars != null ? envVars.get(field) : null;
                return value != null ? value : "";
            }
            default -> {
                return "";
            }
        }
    }
}
