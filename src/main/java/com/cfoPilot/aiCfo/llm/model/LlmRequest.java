package com.cfoPilot.aiCfo.llm.model;

import lombok.Builder;
import lombok.Value;

/**
 * Provider-neutral language call. Null temperature/maxTokens fall back to configured defaults.
 */
@Value
@Builder
public class LlmRequest {
    String prompt;
    String systemPrompt;
    Double temperature;
    Integer maxTokens;
    @Builder.Default
    boolean jsonResponse = false;
}
