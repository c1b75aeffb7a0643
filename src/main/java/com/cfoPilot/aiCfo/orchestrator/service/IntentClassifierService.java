package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.gateway.exception.InvalidInputException;
import com.cfoPilot.aiCfo.llm.client.LlmClient;
import com.cfoPilot.aiCfo.llm.exception.LlmCallException;
import com.cfoPilot.aiCfo.llm.exception.LlmRateLimitedException;
import com.cfoPilot.aiCfo.llm.model.LlmRequest;
import com.cfoPilot.aiCfo.llm.model.LlmResponse;
import com.cfoPilot.aiCfo.llm.util.JsonPayloadExtractor;
import com.cfoPilot.aiCfo.orchestrator.dto.IntentClassificationDTO;
import com.cfoPilot.aiCfo.orchestrator.model.ClassificationValidation;
import com.cfoPilot.aiCfo.orchestrator.model.DegradedReason;
import com.cfoPilot.aiCfo.orchestrator.model.IntentClassification;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.Slot;
import com.cfoPilot.aiCfo.orchestrator.model.SlotName;
import com.cfoPilot.aiCfo.orchestrator.model.StageResult;
import com.cfoPilot.aiCfo.orchestrator.prompt.IntentClassificationPrompt;
import com.cfoPilot.aiCfo.orchestrator.util.IntentMatcher;
import com.cfoPilot.aiCfo.orchestrator.util.SlotExtractor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Intent classification service - turns free text into (intent, confidence, slots).
 *
 * Primary path asks the language capability; any failure, malformed answer, unknown intent
 * or confidence below 0.6 degrades silently to the pattern-based path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentClassifierService {

    static final double ACCEPT_THRESHOLD = 0.6;
    static final double CLARIFICATION_THRESHOLD = 0.5;
    static final String FALLBACK_MODEL = "pattern_fallback";

    private final LlmClient llmClient;
    private final RateLimitState rateLimitState;
    private final ObjectMapper objectMapper;
    private final IntentMatcher intentMatcher = IntentMatcher.standard();

    /**
     * Classifies the query.
     *
     * @param text User query
     * @return classification, never null
     * @throws InvalidInputException if the text is null or blank
     */
    public IntentClassification classify(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Query text is required");
        }

        StageResult<IntentClassification> primary = classifyWithLlm(text);
        if (primary.isSuccess()) {
            return primary.getValue();
        }

        log.debug("Classifier degraded to pattern fallback - reason: {}, detail: {}",
                primary.getReason(), primary.getDetail());
        return classifyWithPatterns(text);
    }

    StageResult<IntentClassification> classifyWithLlm(String text) {
        if (rateLimitState.isCoolingDown()) {
            return StageResult.degraded(DegradedReason.RATE_LIMITED, "cooldown active");
        }
        if (!llmClient.isConfigured()) {
            return StageResult.degraded(DegradedReason.LLM_NOT_CONFIGURED, "no API key");
        }

        LlmResponse response;
        try {
            response = llmClient.call(LlmRequest.builder()
                    .prompt(text)
                    .systemPrompt(IntentClassificationPrompt.SYSTEM_PROMPT)
                    .temperature(0.3)
                    .maxTokens(500)
                    .jsonResponse(true)
                    .build());
        } catch (LlmRateLimitedException e) {
            rateLimitState.recordRateLimit();
            return StageResult.degraded(DegradedReason.RATE_LIMITED, e.getMessage());
        } catch (LlmCallException e) {
            return StageResult.degraded(DegradedReason.LLM_FAILED, e.getMessage());
        }

        String json = JsonPayloadExtractor.extractObject(response.getContent());
        if (json == null) {
            return StageResult.degraded(DegradedReason.MALFORMED_OUTPUT, "no JSON object in response");
        }

        IntentClassificationDTO dto;
        try {
            dto = objectMapper.readValue(json, IntentClassificationDTO.class);
        } catch (JsonProcessingException e) {
            return StageResult.degraded(DegradedReason.MALFORMED_OUTPUT, e.getOriginalMessage());
        }

        IntentType intent = IntentType.fromWire(dto.getIntent()).orElse(null);
        if (intent == null) {
            return StageResult.degraded(DegradedReason.MALFORMED_OUTPUT, "unknown intent " + dto.getIntent());
        }
        double confidence = dto.getConfidence() != null ? dto.getConfidence() : 0;
        if (confidence < ACCEPT_THRESHOLD || confidence > 1) {
            return StageResult.degraded(DegradedReason.LOW_CONFIDENCE, "confidence " + confidence);
        }

        return StageResult.success(IntentClassification.builder()
                .intent(intent)
                .confidence(confidence)
                .slots(toSlots(dto.getSlots()))
                .usedFallback(false)
                .modelUsed(response.getModel())
                .originalInput(text)
                .build());
    }

    /**
     * Pattern-based classification: keywords from the lowercased query, numbers from the original.
     */
    public IntentClassification classifyWithPatterns(String text) {
        Map<SlotName, Slot> slots = SlotExtractor.extract(text);
        IntentMatcher.Match match = intentMatcher.match(text.toLowerCase(Locale.ROOT), slots.keySet());

        return IntentClassification.builder()
                .intent(match.intent())
                .confidence(match.confidence())
                .slots(slots)
                .usedFallback(true)
                .modelUsed(FALLBACK_MODEL)
                .originalInput(text)
                .build();
    }

    /**
     * Checks a classification against the taxonomy and confidence bounds.
     */
    public ClassificationValidation validate(IntentClassification classification) {
        List<String> issues = new ArrayList<>();
        if (classification.getIntent() == null) {
            issues.add("Invalid intent: missing");
        }
        double confidence = classification.getConfidence();
        if (Double.isNaN(confidence) || confidence < 0 || confidence > 1) {
            issues.add("Confidence out of range: " + confidence);
        }
        boolean requiresClarification = confidence < CLARIFICATION_THRESHOLD;
        if (requiresClarification) {
            issues.add("Low classification confidence");
        }
        return ClassificationValidation.builder()
                .valid(issues.isEmpty())
                .issues(issues)
                .requiresClarification(requiresClarification)
                .build();
    }

    private Map<SlotName, Slot> toSlots(Map<String, IntentClassificationDTO.SlotDTO> raw) {
        Map<SlotName, Slot> slots = new EnumMap<>(SlotName.class);
        if (raw == null) {
            return slots;
        }
        raw.forEach((name, dto) -> SlotName.fromWire(name).ifPresent(slotName -> {
            Double value = toDouble(dto.getNormalizedValue());
            if (value == null) {
                value = toDouble(dto.getValue());
            }
            if (value == null || value.isNaN() || value.isInfinite()) {
                return;
            }
            double confidence = dto.getConfidence() != null ? dto.getConfidence() : 0.8;
            slots.put(slotName, Slot.builder()
                    .rawValue(dto.getValue() != null ? dto.getValue().toString() : value.toString())
                    .normalizedValue(value)
                    .currency(dto.getCurrency())
                    .confidence(Math.max(0, Math.min(1, confidence)))
                    .unit(dto.getUnit())
                    .build());
        }));
        return slots;
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.replace(",", "").trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
