package com.cfoPilot.aiCfo.orchestrator.model;

import com.cfoPilot.aiCfo.repository.model.FinancialSummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Evidence retrieved for one (org, intent) pair.
 */
@Value
@Builder
public class GroundingContext {

    /** Top-K evidence, highest score first. */
    List<EvidenceDocument> evidence;

    /** Assumptions of the latest model, or null when the org has no model. */
    Map<String, Object> modelState;

    /** Summary of the latest completed run, or null. */
    FinancialSummary latestSummary;

    /** Recommendations carried by recent plans. */
    List<Recommendation> recentRecommendations;

    /** Mean score of the retained evidence, 0.5 when empty. */
    double confidence;

    public static GroundingContext empty() {
        return GroundingContext.builder()
                .evidence(List.of())
                .recentRecommendations(List.of())
                .confidence(0.5)
                .build();
    }
}
