package com.cfoPilot.aiCfo.orchestrator.model;

import com.cfoPilot.aiCfo.gateway.model.RequestContext;
import com.cfoPilot.aiCfo.repository.model.OverviewMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestration state - maintains state throughout the query pipeline.
 *
 * Contains all intermediate data and results as the request flows through the stages.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrchestrationState {

    /**
     * Original request context.
     */
    private RequestContext requestContext;

    @Builder.Default
    private PipelineStage stage = PipelineStage.RECEIVED;

    /**
     * Classification result (primary or pattern fallback).
     */
    private IntentClassification classification;

    private GroundingContext grounding;

    private PlannerResult plannerResult;

    @Builder.Default
    private List<ExecutionResult> executionResults = new ArrayList<>();

    /**
     * Overview fast-path figures followed by execution results.
     */
    @Builder.Default
    private Map<String, Double> calculations = new LinkedHashMap<>();

    private StructuredResponse response;

    private OverviewMetrics overview;

    /**
     * Whether the org has a live accounting connector.
     */
    @Builder.Default
    private boolean hasConnectedAccounting = false;

    @Builder.Default
    private long transactionCount = 0;

    /**
     * First reason the pipeline had to degrade, if any.
     */
    private DegradedReason degradedReason;

    private String degradedDetail;

    /**
     * Elapsed milliseconds per completed stage.
     */
    @Builder.Default
    private Map<PipelineStage, Long> stageTimings = new EnumMap<>(PipelineStage.class);

    public boolean hasFinancialData() {
        return transactionCount > 0 || (overview != null && overview.hasActivity());
    }

    /**
     * Records a degradation, keeping the first one seen.
     */
    public void degrade(DegradedReason reason, String detail) {
        if (degradedReason == null) {
            degradedReason = reason;
            degradedDetail = detail;
        }
    }
}
