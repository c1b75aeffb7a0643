package com.cfoPilot.aiCfo.llm.client;

import com.cfoPilot.aiCfo.llm.exception.LlmCallException;
import com.cfoPilot.aiCfo.llm.exception.LlmRateLimitedException;
import com.cfoPilot.aiCfo.llm.model.LlmRequest;
import com.cfoPilot.aiCfo.llm.model.LlmResponse;

/**
 * Language capability used by the classifier and the AI generation worker.
 */
public interface LlmClient {

    /**
     * @throws LlmRateLimitedException when the provider is throttling this key
     * @throws LlmCallException for every other failure
     */
    LlmResponse call(LlmRequest request);

    boolean isConfigured();

    String modelName();
}
