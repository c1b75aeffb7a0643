package com.cfoPilot.aiCfo.orchestrator.model;

/**
 * Why a stage fell short of its primary result. Every reason is recovered locally.
 */
public enum DegradedReason {
    LLM_NOT_CONFIGURED("Language capability not configured"),
    LLM_FAILED("Language call failed"),
    RATE_LIMITED("Rate-limit cooldown active"),
    LOW_CONFIDENCE("Model answer below confidence threshold"),
    MALFORMED_OUTPUT("Model answer could not be parsed"),
    PROBE_TIMEOUT("Data probe timed out"),
    PLANNER_ISSUES("Planner reported validation issues"),
    APPROVAL_REQUIRED("Action requires approval"),
    WORKER_TIMEOUT("AI generation did not complete in time"),
    WORKER_FAILED("AI generation failed"),
    MISSING_NATURAL_TEXT("AI generation completed without natural language text"),
    STAGE_ERROR("Unexpected stage error");

    private final String description;

    DegradedReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
