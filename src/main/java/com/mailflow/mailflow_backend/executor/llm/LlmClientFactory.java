package com.mailflow.mailflow_backend.executor.llm;

import com.mailflow.mailflow_backend.model.domain.LlmProvider;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class LlmClientFactory {

    private final Map<LlmProvider, LlmClient> clientMap = new EnumMap<>(LlmProvider.class);

    public LlmClientFactory(List<LlmClient> clients) {
        for (LlmClient client : clients) {
            clientMap.put(client.getProvider(), client);
        }
        clientMap.putIfAbsent(LlmProvider.GROQ, new OpenAiCompatibleLlmClient(
            LlmProvider.GROQ, LlmProvider.GROQ.getDefaultEndpoint(), "llama-3.3-70b-versatile"));
        clientMap.putIfAbsent(LlmProvider.MISTRAL, new OpenAiCompatibleLlmClient(
            LlmProvider.MISTRAL, LlmProvider.MISTRAL.getDefaultEndpoint(), "mistral-small-latest"));
        // Self-hosted endpoints must come from the config row
        clientMap.putIfAbsent(LlmProvider.CUSTOM, new OpenAiCompatibleLlmClient(LlmProvider.CUSTOM, "", ""));
    }

    public LlmClient getClient(LlmProvider provider) {
        LlmClient client = clientMap.get(provider);
        if (client == null) {
            throw new IllegalArgumentException("No LlmClient registered for provider: " + provider);
        }
        return client;
    }
}
