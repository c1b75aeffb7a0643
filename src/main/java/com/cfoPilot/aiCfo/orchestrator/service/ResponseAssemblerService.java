package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.orchestrator.model.EvidenceDocument;
import com.cfoPilot.aiCfo.orchestrator.model.ExecutionResult;
import com.cfoPilot.aiCfo.orchestrator.model.GroundingContext;
import com.cfoPilot.aiCfo.orchestrator.model.IntentClassification;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.PlannerResult;
import com.cfoPilot.aiCfo.orchestrator.model.ResponseValidation;
import com.cfoPilot.aiCfo.orchestrator.model.StructuredResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the versioned, audit-stamped structured response from the pipeline outputs.
 */
@Slf4j
@Service
public class ResponseAssemblerService {

    static final double LOW_INTENT_CONFIDENCE = 0.85;
    static final double LOW_GROUNDING_CONFIDENCE = 0.6;
    static final int SNIPPET_CHARS = 200;

    private final Clock clock;
    private final String modelVersion;

    public ResponseAssemblerService(Clock clock,
                                    @Value("${ai-cfo.response.model-version:v1.0}") String modelVersion) {
        this.clock = clock;
        this.modelVersion = modelVersion;
    }

    public StructuredResponse assemble(IntentClassification classification, GroundingContext grounding,
                                       PlannerResult plannerResult, List<ExecutionResult> executionResults) {
        String requestId = UUID.randomUUID().toString();
        Instant now = clock.instant();

        Map<String, Double> calculations = new LinkedHashMap<>();
        for (ExecutionResult result : executionResults) {
            if (!result.hasValue()) {
                continue;
            }
            if (result.getOperation().getCategoryKey() != null) {
                calculations.put(result.getOperation().getCategoryKey(), result.getValue());
            }
            calculations.put(result.getOperation().getWireName(), result.getValue());
        }

        List<String> warnings = new ArrayList<>(plannerResult.getValidation().getWarnings());
        if (classification.getConfidence() < LOW_INTENT_CONFIDENCE) {
            warnings.add("Low intent confidence");
        }
        if (grounding.getConfidence() < LOW_GROUNDING_CONFIDENCE) {
            warnings.add("Low grounding confidence");
        }

        List<StructuredResponse.EvidenceSnippet> evidence = grounding.getEvidence().stream()
                .map(ResponseAssemblerService::snippet)
                .toList();

        return StructuredResponse.builder()
                .requestId(requestId)
                .intent(classification.getIntent())
                .input(new StructuredResponse.Input(classification.getOriginalInput(), classification.getSlots()))
                .validation(plannerResult.getValidation())
                .calculations(calculations)
                .recommendations(List.of())
                .evidence(evidence)
                .warnings(warnings)
                .errors(List.copyOf(plannerResult.getValidation().getIssues()))
                .audit(StructuredResponse.Audit.builder()
                        .modelVersion(modelVersion)
                        .llmModel(classification.getModelUsed())
                        .promptId("p-" + requestId.substring(0, 8))
                        .timestamp(now)
                        .build())
                .timestamp(now)
                .build();
    }

    /**
     * Checks required fields, the externally supported intents and that every calculation is finite.
     */
    public ResponseValidation validate(StructuredResponse response) {
        List<String> issues = new ArrayList<>();
        if (response.getRequestId() == null) {
            issues.add("Missing request_id");
        }
        if (response.getIntent() == null) {
            issues.add("Missing intent");
        } else if (!IntentType.RESPONSE_SUPPORTED.contains(response.getIntent())) {
            issues.add("Invalid intent: " + response.getIntent().getWireName());
        }
        if (response.getTimestamp() == null) {
            issues.add("Missing timestamp");
        }
        if (response.getAudit() == null) {
            issues.add("Missing audit");
        }
        if (response.getCalculations() != null) {
            response.getCalculations().forEach((key, value) -> {
                if (value == null || value.isNaN() || value.isInfinite()) {
                    issues.add("Invalid calculation result for %s: %s".formatted(key, value));
                }
            });
        }
        if (!issues.isEmpty()) {
            log.debug("Structured response failed validation - requestId: {}, issues: {}",
                    response.getRequestId(), issues);
        }
        return ResponseValidation.builder()
                .valid(issues.isEmpty())
                .issues(issues)
                .build();
    }

    private static StructuredResponse.EvidenceSnippet snippet(EvidenceDocument doc) {
        String content = doc.getContent() == null ? "" : doc.getContent();
        return new StructuredResponse.EvidenceSnippet(
                doc.getId(),
                doc.getRelevanceScore(),
                content.length() > SNIPPET_CHARS ? content.substring(0, SNIPPET_CHARS) : content);
    }
}
