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

/**
 * generateContent client. Gemini has no separate system role here, so the system prompt
 * is prepended to the user text.
 */
@Component
public class GeminiLlmClient extends HttpLlmClient {

    @Override
    public LlmProvider getProvider() { return LlmProvider.GEMINI; }

    @Override
    public String getDefaultModel() { return "gemini-2.0-flash"; }

    @Override
    protected HttpRequest buildRequest(LlmRequest req, String apiKey, String endpoint) throws Exception {
        String baseUrl = pick(endpoint, LlmProvider.GEMINI.getDefaultEndpoint());
        String url = baseUrl.replace("{model}", resolveModel(req)) + "?key=" + apiKey;

        String fullUserText = req.getUserPrompt();
        if (req.getSystemPrompt() != null && !req.getSystemPrompt().isBlank()) {
            fullUserText = req.getSystemPrompt() + "\n\n" + fullUserText;
        }

        Map<String, Object> genConfig = new LinkedHashMap<>();
        genConfig.put("temperature", req.getTemperature());
        genConfig.put("maxOutputTokens", req.getMaxTokens());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", fullUserText)))));
        body.put("generationConfig", genConfig);

        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
    }

    @Override
    @SuppressWarnings("unchecked")
    protected LlmResponse parseResponse(Map<String, Object> resp, String requestedModel) {
        List<Map<String, Object>> candidates = (List<Map<String, Object>>) resp.get("candidates");
        if (candidates == null || candidates.isEmpty()) {
            return LlmResponse.error("Gemini returned no candidates");
        }
        Map<String, Object> content = (Map<String, Object>) candidates.get(0).get("content");
        List<Map<String, Object>> parts = content != null ? (List<Map<String, Object>>) content.get("parts") : null;
        if (parts == null || parts.isEmpty()) {
            return LlmResponse.error("Gemini returned an empty candidate");
        }
        String text = (String) parts.get(0).get("text");
        Map<String, Object> usage = (Map<String, Object>) resp.get("usageMetadata");
        return LlmResponse.ok(text, requestedModel, intValue(usage, "promptTokenCount"), intValue(usage, "candidatesTokenCount"));
    }
}
