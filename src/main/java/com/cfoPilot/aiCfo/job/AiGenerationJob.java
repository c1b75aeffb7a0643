package com.cfoPilot.aiCfo.job;

import com.cfoPilot.aiCfo.orchestrator.model.EvidenceDocument;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Input of one AI generation job. The worker writes its result back onto the plan.
 */
@Value
@Builder
public class AiGenerationJob {
    String planId;
    String orgId;
    String userId;
    String query;
    IntentType intent;
    Map<String, Double> calculations;
    List<EvidenceDocument> evidence;
}
