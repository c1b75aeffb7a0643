package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.orchestrator.model.ActionParams;
import com.cfoPilot.aiCfo.orchestrator.model.DocType;
import com.cfoPilot.aiCfo.orchestrator.model.EvidenceDocument;
import com.cfoPilot.aiCfo.orchestrator.model.ExecutionResult;
import com.cfoPilot.aiCfo.orchestrator.model.GroundingContext;
import com.cfoPilot.aiCfo.orchestrator.model.IntentClassification;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.Operation;
import com.cfoPilot.aiCfo.orchestrator.model.PlanValidation;
import com.cfoPilot.aiCfo.orchestrator.model.PlannerResult;
import com.cfoPilot.aiCfo.orchestrator.model.ResponseValidation;
import com.cfoPilot.aiCfo.orchestrator.model.StructuredResponse;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseAssemblerServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-01T10:00:00Z");

    private final ResponseAssemblerService assembler =
            new ResponseAssemblerService(Clock.fixed(NOW, ZoneOffset.UTC), "v1.0");

    @Test
    void calculationsArePublishedUnderCategoryAndOperationKeys() {
        StructuredResponse response = assembler.assemble(classification(0.95), grounding(0.8), plannerResult(),
                List.of(ExecutionResult.builder()
                        .operation(Operation.CALCULATE_RUNWAY)
                        .params(new ActionParams.Runway(600_000, 50_000, 12, false, false))
                        .value(12.0)
                        .build()));

        assertThat(response.getCalculations())
                .containsEntry("runway", 12.0)
                .containsEntry("calculate_runway", 12.0);
        assertThat(response.getWarnings()).isEmpty();
        assertThat(response.getAudit().getModelVersion()).isEqualTo("v1.0");
        assertThat(response.getAudit().getPromptId()).isEqualTo("p-" + response.getRequestId().substring(0, 8));
        assertThat(response.getTimestamp()).isEqualTo(NOW);
        assertThat(assembler.validate(response).isValid()).isTrue();
    }

    @Test
    void lowConfidenceProducesWarnings() {
        StructuredResponse response = assembler.assemble(classification(0.7), grounding(0.5), plannerResult(), List.of());

        assertThat(response.getWarnings()).containsExactly("Low intent confidence", "Low grounding confidence");
    }

    @Test
    void evidenceSnippetsAreTruncated() {
        GroundingContext grounding = GroundingContext.builder()
                .evidence(List.of(EvidenceDocument.builder()
                        .id("model-1").docType(DocType.MODEL_ASSUMPTION).content("x".repeat(500)).relevanceScore(0.9)
                        .build()))
                .recentRecommendations(List.of())
                .confidence(0.9)
                .build();

        StructuredResponse response = assembler.assemble(classification(0.95), grounding, plannerResult(), List.of());

        assertThat(response.getEvidence().get(0).getSnippet()).hasSize(200);
    }

    @Test
    void nonFiniteCalculationFailsValidation() {
        StructuredResponse response = assembler.assemble(classification(0.95), grounding(0.8), plannerResult(), List.of());
        Map<String, Double> calculations = new LinkedHashMap<>();
        calculations.put("runway", Double.NaN);
        calculations.put("burnRate", Double.POSITIVE_INFINITY);

        ResponseValidation validation = assembler.validate(response.toBuilder().calculations(calculations).build());

        assertThat(validation.isValid()).isFalse();
        assertThat(validation.getIssues()).containsExactly(
                "Invalid calculation result for runway: NaN",
                "Invalid calculation result for burnRate: Infinity");
    }

    @Test
    void intentOutsideResponseSchemaIsRejected() {
        StructuredResponse response = assembler.assemble(classification(0.95), grounding(0.8), plannerResult(), List.of());

        ResponseValidation validation = assembler.validate(response.toBuilder().intent(IntentType.HIRE_IMPACT).build());

        assertThat(validation.getIssues()).containsExactly("Invalid intent: hire_impact");
    }

    private static IntentClassification classification(double confidence) {
        return IntentClassification.builder()
                .intent(IntentType.RUNWAY_CALCULATION)
                .confidence(confidence)
                .modelUsed("pattern_fallback")
                .originalInput("What is our runway?")
                .build();
    }

    private static GroundingContext grounding(double confidence) {
        return GroundingContext.builder()
                .evidence(List.of())
                .recentRecommendations(List.of())
                .confidence(confidence)
                .build();
    }

    private static PlannerResult plannerResult() {
        return PlannerResult.builder()
                .actions(List.of())
                .validation(PlanValidation.builder().ok(true).issues(List.of()).warnings(List.of()).build())
                .build();
    }
}
