package com.mailflow.mailflow_backend.executor.llm;

/** Resolves the text-completion capability a user's workflows classify with. */
@FunctionalInterface
public interface AiClientResolver {

    /**
     * @throws AiClientException when no provider is configured for the user
     */
    TextCompletion resolve(String userId);
}
