package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;
import java.util.Map;

/**
 * One piece of grounding evidence with its relevance score in [0,1].
 */
@Value
@Builder
public class EvidenceDocument {
    String id;
    DocType docType;
    String content;
    @With
    double relevanceScore;
    Map<String, Object> metadata;
    Instant timestamp;
}
