package com.mailflow.mailflow_backend.config;

import com.mailflow.mailflow_backend.model.domain.LlmProvider;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under the "mailflow" prefix in application.yml.
 */
@ConfigurationProperties(prefix = "mailflow")
@Data
public class MailflowProperties {

    private ExecutorConfig executor = new ExecutorConfig();

    private ExecutionsConfig executions = new ExecutionsConfig();

    private AiConfig ai = new AiConfig();

    private NotificationsConfig notifications = new NotificationsConfig();

    private EventsConfig events = new EventsConfig();

    /** Values exposed to notification templates as {{$env.NAME}}. */
    private Map<String, String> env = new LinkedHashMap<>();

    /**
     * poolSize threads run sibling branches; dispatchPoolSize threads run whole executions.
     */
    @Data
    public static class ExecutorConfig {
        private int poolSize = 8;
        private int dispatchPoolSize = 4;
        private int queueCapacity = 500;
    }

    @Data
    public static class ExecutionsConfig {
        /** Executions older than this many days are deleted by the cleanup job. */
        private int retentionDays = 30;
        private String cleanupCron = "0 30 3 * * *";
        /** Used when a workflow sets no executionTimeout. */
        private long defaultTimeoutMs = 300_000L;
    }

    /**
     * Fallback provider when neither the user nor a global config row defines one.
     */
    @Data
    public static class AiConfig {
        private LlmProvider defaultProvider;
        private String defaultModel;
        private String apiKey;
        private String endpoint;
    }

    @Data
    public static class NotificationsConfig {
        private String telegramBaseUrl = "https://api.telegram.org";
    }

    @Data
    public static class EventsConfig {
        private RedisBridgeConfig redisBridge = new RedisBridgeConfig();
    }

    @Data
    public static class RedisBridgeConfig {
        private boolean enabled = false;
    }
}
