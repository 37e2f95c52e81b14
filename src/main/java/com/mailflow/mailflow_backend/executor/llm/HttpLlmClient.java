package com.mailflow.mailflow_backend.executor.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailflow.mailflow_backend.model.llm.LlmRequest;
import com.mailflow.mailflow_backend.model.llm.LlmResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Shared HTTP plumbing for the provider clients. Subclasses build the provider request
 * and read the provider response; sending, status handling and error extraction live here.
 */
public abstract class HttpLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(HttpLlmClient.class);

    protected static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {};

    protected final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient;

    protected HttpLlmClient() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    protected HttpLlmClient(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public LlmResponse call(LlmRequest req, String apiKey, String endpoint) {
        String label = getProvider().getDisplayName();
        try {
            HttpRequest httpReq = buildRequest(req, apiKey, endpoint);
            HttpResponse<String> httpResp = httpClient.send(httpReq, HttpResponse.BodyHandlers.ofString());
            if (httpResp.statusCode() != 200) {
                log.error("[{}] HTTP {}", getProvider(), httpResp.statusCode());
                return LlmResponse.error(label + " API error " + httpResp.statusCode() + ": " + extractError(httpResp.body()));
            }
            return parseResponse(mapper.readValue(httpResp.body(), JSON_MAP), resolveModel(req));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LlmResponse.error(label + " call interrupted");
        } catch (Exception e) {
            log.error("[{}] Exception calling API", getProvider(), e);
            return LlmResponse.error(label + " client exception: " + e.getMessage());
        }
    }

    protected abstract HttpRequest buildRequest(LlmRequest req, String apiKey, String endpoint) throws Exception;

    protected abstract LlmResponse parseResponse(Map<String, Object> body, String requestedModel);

    protected String resolveModel(LlmRequest req) {
        return req.getModel() != null && !req.getModel().isBlank() ? req.getModel() : getDefaultModel();
    }

    protected static String pick(String endpoint, String fallback) {
        return endpoint != null && !endpoint.isBlank() ? endpoint : fallback;
    }

    protected static int intValue(Map<String, Object> map, String key) {
        if (map == null) return 0;
        Object value = map.get(key);
        return value instanceof Number n ? n.intValue() : 0;
    }

    String extractError(String body) {
        try {
            Map<String, Object> parsed = mapper.readValue(body, JSON_MAP);
            Object err = parsed.get("error");
            if (err instanceof Map<?, ?> errMap && errMap.get("message") != null) {
                return errMap.get("message").toString();
            }
            if (err instanceof String s) {
                return s;
            }
        } catch (Exception e) {
            log.debug("Error body is not JSON: {}", e.getMessage());
        }
        return body != null && body.length() > 200 ? body.substring(0, 200) : (body != null ? body : "");
    }
}
