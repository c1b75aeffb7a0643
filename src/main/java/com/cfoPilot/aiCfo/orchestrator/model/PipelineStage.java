package com.cfoPilot.aiCfo.orchestrator.model;

public enum PipelineStage {
    RECEIVED,
    CLASSIFYING,
    GROUNDING,
    PLANNING,
    EXECUTING,
    BLOCKED_FOR_APPROVAL,
    FALLBACK_REASONING,
    RESPONSE_READY
}
