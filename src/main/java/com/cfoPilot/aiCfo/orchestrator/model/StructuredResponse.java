package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Versioned, audit-stamped answer to one query.
 */
@Value
@Builder(toBuilder = true)
public class StructuredResponse {
    String requestId;
    IntentType intent;
    Input input;
    PlanValidation validation;
    Map<String, Double> calculations;
    List<Recommendation> recommendations;
    List<EvidenceSnippet> evidence;
    List<String> warnings;
    List<String> errors;
    Audit audit;
    Instant timestamp;

    @Value
    public static class Input {
        String raw;
        Map<SlotName, Slot> slots;
    }

    @Value
    public static class EvidenceSnippet {
        String docId;
        double score;
        String snippet;
    }

    @Value
    @Builder
    public static class Audit {
        String modelVersion;
        String llmModel;
        String promptId;
        Instant timestamp;
    }
}
