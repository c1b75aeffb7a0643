package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.gateway.exception.InvalidInputException;
import com.cfoPilot.aiCfo.llm.client.LlmClient;
import com.cfoPilot.aiCfo.llm.exception.LlmCallException;
import com.cfoPilot.aiCfo.llm.exception.LlmRateLimitedException;
import com.cfoPilot.aiCfo.llm.model.LlmResponse;
import com.cfoPilot.aiCfo.orchestrator.model.ClassificationValidation;
import com.cfoPilot.aiCfo.orchestrator.model.IntentClassification;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.SlotName;
import com.cfoPilot.aiCfo.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IntentClassifierServiceTest {

    private LlmClient llmClient;
    private MutableClock clock;
    private RateLimitState rateLimitState;
    private IntentClassifierService classifier;

    @BeforeEach
    void setUp() {
        llmClient = mock(LlmClient.class);
        clock = new MutableClock(Instant.parse("2026-10-01T10:00:00Z"));
        rateLimitState = new RateLimitState(clock, Duration.ofSeconds(60));
        classifier = new IntentClassifierService(llmClient, rateLimitState, new ObjectMapper());
    }

    @Test
    void rejectsBlankQuery() {
        assertThatThrownBy(() -> classifier.classify("  "))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Query text is required");
    }

    @Test
    void usesPatternsWhenLanguageCapabilityIsNotConfigured() {
        when(llmClient.isConfigured()).thenReturn(false);

        IntentClassification result = classifier.classify(
                "Cash is $600,000 and burn is $50,000/month, what is our runway?");

        assertThat(result.getIntent()).isEqualTo(IntentType.RUNWAY_CALCULATION);
        assertThat(result.isUsedFallback()).isTrue();
        assertThat(result.getModelUsed()).isEqualTo("pattern_fallback");
        assertThat(result.numericSlot(SlotName.CASH)).contains(600_000d);
        assertThat(result.numericSlot(SlotName.BURN_RATE)).contains(50_000d);
        verify(llmClient, never()).call(any());
    }

    @Test
    void burnQuestionClassifiedWithHighConfidence() {
        when(llmClient.isConfigured()).thenReturn(false);

        IntentClassification result = classifier.classify("What is our burn rate?");

        assertThat(result.getIntent()).isEqualTo(IntentType.BURN_RATE_CALCULATION);
        assertThat(result.getConfidence()).isGreaterThanOrEqualTo(0.90);
    }

    @Test
    void acceptsConfidentModelAnswer() {
        when(llmClient.isConfigured()).thenReturn(true);
        when(llmClient.call(any())).thenReturn(response("""
                ```json
                {"intent": "revenue_forecast", "confidence": 0.88,
                 "slots": {"base_revenue": {"value": "$100k", "normalized_value": 100000},
                           "months": {"value": "6"},
                           "unknown_slot": {"value": 1}}}
                ```"""));

        IntentClassification result = classifier.classify("Forecast revenue from $100k for 6 months");

        assertThat(result.getIntent()).isEqualTo(IntentType.REVENUE_FORECAST);
        assertThat(result.getConfidence()).isEqualTo(0.88);
        assertThat(result.isUsedFallback()).isFalse();
        assertThat(result.getModelUsed()).isEqualTo("test-model");
        assertThat(result.numericSlot(SlotName.BASE_REVENUE)).contains(100_000d);
        assertThat(result.numericSlot(SlotName.MONTHS)).contains(6d);
        assertThat(result.getSlots()).hasSize(2);
    }

    @Test
    void lowConfidenceModelAnswerFallsBack() {
        when(llmClient.isConfigured()).thenReturn(true);
        when(llmClient.call(any())).thenReturn(response("{\"intent\": \"runway_calculation\", \"confidence\": 0.4}"));

        IntentClassification result = classifier.classify("What is our burn rate?");

        assertThat(result.isUsedFallback()).isTrue();
        assertThat(result.getIntent()).isEqualTo(IntentType.BURN_RATE_CALCULATION);
    }

    @Test
    void unknownIntentFallsBack() {
        when(llmClient.isConfigured()).thenReturn(true);
        when(llmClient.call(any())).thenReturn(response("{\"intent\": \"tax_filing\", \"confidence\": 0.95}"));

        assertThat(classifier.classify("What is our runway?").isUsedFallback()).isTrue();
    }

    @Test
    void callFailureFallsBack() {
        when(llmClient.isConfigured()).thenReturn(true);
        when(llmClient.call(any())).thenThrow(new LlmCallException("connection refused"));

        IntentClassification result = classifier.classify("What is our runway?");

        assertThat(result.isUsedFallback()).isTrue();
        assertThat(rateLimitState.isCoolingDown()).isFalse();
    }

    @Test
    void rateLimitStartsCooldownAndSkipsNextCall() {
        when(llmClient.isConfigured()).thenReturn(true);
        when(llmClient.call(any())).thenThrow(new LlmRateLimitedException("Too many requests", 429));

        classifier.classify("What is our runway?");
        assertThat(rateLimitState.isCoolingDown()).isTrue();

        IntentClassification second = classifier.classify("What is our runway?");
        assertThat(second.isUsedFallback()).isTrue();
        verify(llmClient, times(1)).call(any());
    }

    @Test
    void modelIsCalledAgainOnceCooldownExpires() {
        when(llmClient.isConfigured()).thenReturn(true);
        when(llmClient.call(any())).thenThrow(new LlmRateLimitedException("Too many requests", 429));

        classifier.classify("What is our runway?");
        clock.advance(Duration.ofSeconds(59));
        classifier.classify("What is our runway?");
        verify(llmClient, times(1)).call(any());

        clock.advance(Duration.ofSeconds(2));
        IntentClassification afterCooldown = classifier.classify("What is our runway?");

        assertThat(afterCooldown.getIntent()).isEqualTo(IntentType.RUNWAY_CALCULATION);
        verify(llmClient, times(2)).call(any());
    }

    @Test
    void validationFlagsLowConfidenceForClarification() {
        IntentClassification weak = IntentClassification.builder()
                .intent(IntentType.STRATEGY_RECOMMENDATION)
                .confidence(0.45)
                .build();

        ClassificationValidation validation = classifier.validate(weak);

        assertThat(validation.isValid()).isFalse();
        assertThat(validation.isRequiresClarification()).isTrue();
        assertThat(validation.getIssues()).contains("Low classification confidence");
    }

    @Test
    void validationAcceptsConfidentClassification() {
        ClassificationValidation validation = classifier.validate(classifier.classifyWithPatterns("What is our burn rate?"));

        assertThat(validation.isValid()).isTrue();
        assertThat(validation.getIssues()).isEmpty();
    }

    private static LlmResponse response(String content) {
        return LlmResponse.builder().content(content).model("test-model").build();
    }
}
