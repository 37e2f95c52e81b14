package com.mailflow.mailflow_backend.executor.llm;

import com.mailflow.mailflow_backend.model.domain.LlmProvider;
import com.mailflow.mailflow_backend.model.llm.LlmRequest;
import com.mailflow.mailflow_backend.model.llm.LlmResponse;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class AnthropicLlmClient extends HttpLlmClient {

    private static final String ANTHROPIC_VERSION = "2023-06-01";

    @Override
    public LlmProvider getProvider() { return LlmProvider.ANTHROPIC; }

    @Override
    public String getDefaultModel() { return "claude-haiku-4-5-20251001"; }

    @Override
    protected HttpRequest buildRequest(LlmRequest req, String apiKey, String endpoint) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", resolveModel(req));
        body.put("max_tokens", req.getMaxTokens());
        body.put("messages", List.of(Map.of("role", "user", "content", req.getUserPrompt())));
        if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
            body.put("system", req.getSystemPrompt());
        }

        return HttpRequest.newBuilder()
                .uri(URI.create(pick(endpoint, LlmProvider.ANTHROPIC.getDefaultEndpoint())))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .header("anthropic-version", ANTHROPIC_VERSION)
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    protected LlmResponse parseResponse(Map<String, Object> resp, String requestedModel) {
        List<Map<String, Object>> content = (List<Map<String, Object>>) resp.get("content");
        if (content == null || content.isEmpty()) {
            return LlmResponse.error("Anthropic returned no content");
        }
        String text = (String) content.get(0).get("text");
        Map<String, Object> usage = (Map<String, Object>) resp.get("usage");
        String model = (String) resp.getOrDefault("model", requestedModel);
        return LlmResponse.ok(text, model, intValue(usage, "input_tokens"), intValue(usage, "output_tokens"));
    }
}
