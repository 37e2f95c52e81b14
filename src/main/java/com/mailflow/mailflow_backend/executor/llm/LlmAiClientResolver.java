package com.mailflow.mailflow_backend.executor.llm;

import com.mailflow.mailflow_backend.config.MailflowProperties;
import com.mailflow.mailflow_backend.model.domain.LlmProviderConfig;
import com.mailflow.mailflow_backend.model.llm.LlmRequest;
import com.mailflow.mailflow_backend.model.llm.LlmResponse;
import com.mailflow.mailflow_backend.repository.LlmProviderConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Picks the provider for a user: their own enabled config, else the global config row,
 * else the mailflow.ai.* fallback from application.yml.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmAiClientResolver implements AiClientResolver {

    private final LlmProviderConfigRepository configRepository;
    private final LlmClientFactory            clientFactory;
    private final MailflowProperties          properties;

    @Override
    public TextCompletion resolve(String userId) {
        Optional<LlmProviderConfig> config = Optional.ofNullable(userId)
                .flatMap(configRepository::findFirstByUserIdAndEnabledTrueOrderByUpdatedAtDesc)
                .or(configRepository::findFirstByUserIdIsNullAndEnabledTrueOrderByUpdatedAtDesc);

        if (config.isPresent()) {
            LlmProviderConfig cfg = config.get();
            log.debug("[AiClientResolver] user={} provider={} (config {})", userId, cfg.getProvider(), cfg.getId());
            return bind(clientFactory.getClient(cfg.getProvider()), cfg.getApiKey(), cfg.getCustomEndpoint(), cfg.getModel());
        }

        MailflowProperties.AiConfig fallback = properties.getAi();
        if (fallback.getDefaultProvider() != null && fallback.getApiKey() != null && !fallback.getApiKey().isBlank()) {
            return bind(clientFactory.getClient(fallback.getDefaultProvider()),
                    fallback.getApiKey(), fallback.getEndpoint(), fallback.getDefaultModel());
        }

        throw new AiClientException("No AI provider configured for user " + userId);
    }

    private TextCompletion bind(LlmClient client, String apiKey, String endpoint, String model) {
        String effectiveModel = model != null && !model.isBlank() ? model : client.getDefaultModel();
        return (systemPrompt, prompt) -> {
            LlmResponse response = client.call(new LlmRequest(systemPrompt, prompt, effectiveModel), apiKey, endpoint);
            if (!response.isSuccess()) {
                throw new AiClientException(response.getErrorMessage());
            }
            return response.getRawText() != null ? response.getRawText() : "";
        };
    }
}
