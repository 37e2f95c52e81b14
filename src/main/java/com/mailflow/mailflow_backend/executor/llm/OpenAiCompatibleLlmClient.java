package com.mailflow.mailflow_backend.executor.llm;

import com.mailflow.mailflow_backend.model.domain.LlmProvider;
import com.mailflow.mailflow_backend.model.llm.LlmRequest;
import com.mailflow.mailflow_backend.model.llm.LlmResponse;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client. The registered bean talks to OpenAI; LlmClientFactory creates
 * extra instances for Groq, Mistral and self-hosted endpoints that speak the same API.
 */
@Component
public class OpenAiCompatibleLlmClient extends HttpLlmClient {

    private final LlmProvider provider;
    private final String defaultEndpoint;
    private final String defaultModel;

    public OpenAiCompatibleLlmClient() {
        this(LlmProvider.OPENAI, LlmProvider.OPENAI.getDefaultEndpoint(), "gpt-4o-mini");
    }

    public OpenAiCompatibleLlmClient(LlmProvider provider, String defaultEndpoint, String defaultModel) {
        this.provider = provider;
        this.defaultEndpoint = defaultEndpoint;
        this.defaultModel = defaultModel;
    }

    @Override
    public LlmProvider getProvider() { return provider; }

    @Override
    public String getDefaultModel() { return defaultModel; }

    @Override
    protected HttpRequest buildRequest(LlmRequest req, String apiKey, String endpoint) throws Exception {
        List<Map<String, String>> messages = new ArrayList<>();
        if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", req.getSystemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", req.getUserPrompt()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", resolveModel(req));
        body.put("messages", messages);
        body.put("max_tokens", req.getMaxTokens());
        body.put("temperature", req.getTemperature());

        return HttpRequest.newBuilder()
                .uri(URI.create(pick(endpoint, defaultEndpoint)))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    protected LlmResponse parseResponse(Map<String, Object> resp, String requestedModel) {
        List<Map<String, Object>> choices = (List<Map<String, Object>>) resp.get("choices");
        if (choices == null || choices.isEmpty()) {
            return LlmResponse.error(provider.getDisplayName() + " returned no choices");
        }
        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        String text = message != null ? (String) message.get("content") : null;
        Map<String, Object> usage = (Map<String, Object>) resp.get("usage");
        String usedModel = (String) resp.getOrDefault("model", requestedModel);
        return LlmResponse.ok(text, usedModel, intValue(usage, "prompt_tokens"), intValue(usage, "completion_tokens"));
    }
}
