package com.cfoPilot.aiCfo.repository.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Language call kept for audit: what was sent and what came back.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PromptRecord {
    private String id;
    private String orgId;
    private String userId;
    private String modelUsed;
    private String systemPrompt;
    private String userPrompt;
    private String responseText;
    private Integer tokensIn;
    private Integer tokensOut;
    private Instant createdAt;
}
