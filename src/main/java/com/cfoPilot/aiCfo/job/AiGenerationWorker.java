package com.cfoPilot.aiCfo.job;

import com.cfoPilot.aiCfo.llm.client.LlmClient;
import com.cfoPilot.aiCfo.llm.exception.LlmCallException;
import com.cfoPilot.aiCfo.llm.exception.LlmRateLimitedException;
import com.cfoPilot.aiCfo.llm.model.LlmRequest;
import com.cfoPilot.aiCfo.llm.model.LlmResponse;
import com.cfoPilot.aiCfo.llm.util.JsonPayloadExtractor;
import com.cfoPilot.aiCfo.orchestrator.dto.CfoAnalysisDTO;
import com.cfoPilot.aiCfo.orchestrator.model.EvidenceDocument;
import com.cfoPilot.aiCfo.orchestrator.model.Recommendation;
import com.cfoPilot.aiCfo.orchestrator.model.StructuredResponse;
import com.cfoPilot.aiCfo.orchestrator.prompt.CfoAnalysisPrompt;
import com.cfoPilot.aiCfo.orchestrator.service.RateLimitState;
import com.cfoPilot.aiCfo.orchestrator.util.RecommendationDeduplicator;
import com.cfoPilot.aiCfo.repository.PlanRepository;
import com.cfoPilot.aiCfo.repository.PromptRepository;
import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.PlanPayload;
import com.cfoPilot.aiCfo.repository.model.PlanStatus;
import com.cfoPilot.aiCfo.repository.model.PromptRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consumes AI generation jobs: asks the language capability for a CFO analysis of the
 * deterministic calculations and evidence, then writes the answer onto the plan.
 *
 * The plan always ends in {@code completed} or {@code failed}; the pipeline decides what to do with either.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AiGenerationWorker {

    private static final int EVIDENCE_CHARS = 500;

    private final LlmClient llmClient;
    private final PlanRepository planRepository;
    private final PromptRepository promptRepository;
    private final RateLimitState rateLimitState;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void process(String jobId, AiGenerationJob job) {
        String planId = job.getPlanId();
        log.debug("Processing AI generation job - jobId: {}, planId: {}", jobId, planId);
        planRepository.update(planId, plan -> isOpen(plan)
                ? plan.toBuilder().status(PlanStatus.PROCESSING).build()
                : plan);

        try {
            if (rateLimitState.isCoolingDown()) {
                markFailed(planId, "Rate-limit cooldown active");
                return;
            }

            String userMessage = CfoAnalysisPrompt.buildUserMessage(
                    job.getQuery(),
                    objectMapper.writeValueAsString(job.getCalculations() == null ? Map.of() : job.getCalculations()),
                    objectMapper.writeValueAsString(evidenceView(job.getEvidence())));

            LlmResponse response = llmClient.call(LlmRequest.builder()
                    .prompt(userMessage)
                    .systemPrompt(CfoAnalysisPrompt.SYSTEM_PROMPT)
                    .jsonResponse(true)
                    .build());

            PromptRecord prompt = promptRepository.save(PromptRecord.builder()
                    .orgId(job.getOrgId())
                    .userId(job.getUserId())
                    .modelUsed(response.getModel())
                    .systemPrompt(CfoAnalysisPrompt.SYSTEM_PROMPT)
                    .userPrompt(userMessage)
                    .responseText(response.getContent())
                    .tokensIn(response.getPromptTokens())
                    .tokensOut(response.getCompletionTokens())
                    .build());

            String json = JsonPayloadExtractor.extractObject(response.getContent());
            if (json == null) {
                markFailed(planId, "No JSON object in model answer");
                return;
            }
            CfoAnalysisDTO analysis = objectMapper.readValue(json, CfoAnalysisDTO.class);
            complete(planId, analysis, prompt.getId(), response.getModel());
            log.info("AI generation completed - jobId: {}, planId: {}, tokens: {}",
                    jobId, planId, response.getTotalTokens());

        } catch (LlmRateLimitedException e) {
            rateLimitState.recordRateLimit();
            markFailed(planId, e.getMessage());
        } catch (LlmCallException e) {
            markFailed(planId, e.getMessage());
        } catch (JsonProcessingException e) {
            markFailed(planId, "Malformed model answer: " + e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.error("AI generation job crashed - jobId: {}, planId: {}", jobId, planId, e);
            markFailed(planId, e.getMessage());
        }
    }

    private void complete(String planId, CfoAnalysisDTO analysis, String promptId, String modelUsed) {
        List<Recommendation> recommendations = RecommendationDeduplicator.deduplicate(
                analysis.getRecommendations() == null ? List.of()
                        : analysis.getRecommendations().stream().map(this::toRecommendation).toList());

        planRepository.update(planId, plan -> {
            if (!isOpen(plan)) {
                log.info("Plan {} already answered by fallback, dropping AI result", planId);
                return plan;
            }
            PlanPayload payload = plan.getPayload() != null ? plan.getPayload() : new PlanPayload();
            Map<String, Object> metadata = copyMetadata(payload);
            metadata.put("promptIds", List.of(promptId));
            metadata.put("modelUsed", modelUsed);

            StructuredResponse structured = payload.getStructuredResponse();
            if (structured != null) {
                structured = structured.toBuilder()
                        .recommendations(recommendations)
                        .audit(StructuredResponse.Audit.builder()
                                .modelVersion(structured.getAudit() != null ? structured.getAudit().getModelVersion() : null)
                                .llmModel(modelUsed)
                                .promptId(promptId)
                                .timestamp(clock.instant())
                                .build())
                        .build();
            }

            return plan.toBuilder()
                    .status(PlanStatus.COMPLETED)
                    .payload(payload.toBuilder()
                            .naturalText(analysis.getNaturalLanguage())
                            .recommendations(recommendations)
                            .risks(analysis.getRisks() == null ? List.of() : analysis.getRisks())
                            .warnings(mergeWarnings(payload.getWarnings(), analysis.getWarnings()))
                            .structuredResponse(structured)
                            .metadata(metadata)
                            .generatedAt(clock.instant())
                            .build())
                    .build();
        });
    }

    private void markFailed(String planId, String error) {
        log.warn("AI generation failed - planId: {}, error: {}", planId, error);
        planRepository.update(planId, plan -> {
            if (!isOpen(plan)) {
                return plan;
            }
            PlanPayload payload = plan.getPayload() != null ? plan.getPayload() : new PlanPayload();
            Map<String, Object> metadata = copyMetadata(payload);
            metadata.put("error", error == null ? "unknown" : error);
            return plan.toBuilder()
                    .status(PlanStatus.FAILED)
                    .payload(payload.toBuilder().metadata(metadata).build())
                    .build();
        });
    }

    private Recommendation toRecommendation(CfoAnalysisDTO.RecommendationDTO dto) {
        double confidence = dto.getConfidence() == null ? 0.7 : Math.max(0, Math.min(1, dto.getConfidence()));
        return Recommendation.builder()
                .type(dto.getType())
                .category(dto.getCategory())
                .title(dto.getTitle())
                .action(dto.getTitle())
                .summary(dto.getSummary())
                .reasoning(dto.getSummary())
                .explain(dto.getExplain())
                .impact(dto.getImpact() == null ? Map.of() : dto.getImpact())
                .priority(dto.getPriority() == null ? "medium" : dto.getPriority())
                .confidence(confidence)
                .evidence(List.of())
                .dataSources(List.of())
                .build();
    }

    private static List<Map<String, Object>> evidenceView(List<EvidenceDocument> evidence) {
        if (evidence == null) {
            return List.of();
        }
        List<Map<String, Object>> view = new ArrayList<>();
        for (EvidenceDocument doc : evidence) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", doc.getId());
            item.put("type", doc.getDocType().getWireName());
            item.put("score", doc.getRelevanceScore());
            String content = doc.getContent() == null ? "" : doc.getContent();
            item.put("content", content.length() > EVIDENCE_CHARS ? content.substring(0, EVIDENCE_CHARS) : content);
            view.add(item);
        }
        return view;
    }

    /**
     * Only queued or processing plans accept worker results; the pipeline may have moved on.
     */
    private static boolean isOpen(AiCfoPlan plan) {
        return plan.getStatus() == PlanStatus.QUEUED || plan.getStatus() == PlanStatus.PROCESSING;
    }

    private static Map<String, Object> copyMetadata(PlanPayload payload) {
        Map<String, Object> metadata = new HashMap<>();
        if (payload.getMetadata() != null) {
            metadata.putAll(payload.getMetadata());
        }
        return metadata;
    }

    private static List<String> mergeWarnings(List<String> existing, List<String> generated) {
        List<String> merged = new ArrayList<>(existing == null ? List.of() : existing);
        if (generated != null) {
            generated.stream().filter(w -> !merged.contains(w)).forEach(merged::add);
        }
        return merged;
    }
}
