package com.cfoPilot.aiCfo.gateway.dto;

import com.cfoPilot.aiCfo.orchestrator.model.AgentTrace;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgenticQueryResponse {
    private String planId;
    private AgentTrace response;
    private long processingTimeMs;
}
