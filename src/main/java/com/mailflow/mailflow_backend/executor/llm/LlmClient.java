package com.mailflow.mailflow_backend.executor.llm;

import com.mailflow.mailflow_backend.model.domain.LlmProvider;
import com.mailflow.mailflow_backend.model.llm.LlmRequest;
import com.mailflow.mailflow_backend.model.llm.LlmResponse;

public interface LlmClient {

    LlmProvider getProvider();

    // Never throws; transport and API failures come back as LlmResponse.error
    LlmResponse call(LlmRequest request, String apiKey, String endpoint);

    String getDefaultModel();
}
