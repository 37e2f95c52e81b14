package com.mailflow.mailflow_backend.executor.llm;

/**
 * A single text-completion capability bound to one provider and model.
 */
@FunctionalInterface
public interface TextCompletion {

    /**
     * @return the model's reply text
     * @throws AiClientException when the provider call fails
     */
    String complete(String systemPrompt, String prompt);
}
