package com.cfoPilot.aiCfo.llm.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LlmResponse {
    String content;
    String model;
    Integer promptTokens;
    Integer completionTokens;
    Integer totalTokens;
}
