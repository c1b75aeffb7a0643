package com.cfoPilot.aiCfo.job;

import com.cfoPilot.aiCfo.llm.client.LlmClient;
import com.cfoPilot.aiCfo.llm.exception.LlmRateLimitedException;
import com.cfoPilot.aiCfo.llm.model.LlmResponse;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.service.RateLimitState;
import com.cfoPilot.aiCfo.repository.memory.InMemoryPlanRepository;
import com.cfoPilot.aiCfo.repository.memory.InMemoryPromptRepository;
import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.PlanPayload;
import com.cfoPilot.aiCfo.repository.model.PlanStatus;
import com.cfoPilot.aiCfo.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AiGenerationWorkerTest {

    private static final String ORG_ID = "3f2a9c1e-8b4d-4f6a-a1c2-9e7d5b3a1c90";

    private LlmClient llmClient;
    private InMemoryPlanRepository planRepository;
    private InMemoryPromptRepository promptRepository;
    private RateLimitState rateLimitState;
    private AiGenerationWorker worker;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-10-01T10:00:00Z"));
        llmClient = mock(LlmClient.class);
        planRepository = new InMemoryPlanRepository(clock);
        promptRepository = new InMemoryPromptRepository(clock);
        rateLimitState = new RateLimitState(clock, Duration.ofSeconds(60));
        worker = new AiGenerationWorker(llmClient, planRepository, promptRepository, rateLimitState,
                new ObjectMapper(), clock);
    }

    @Test
    void completesPlanWithDeduplicatedRecommendations() {
        AiCfoPlan plan = queuedPlan();
        when(llmClient.call(any())).thenReturn(LlmResponse.builder()
                .model("gpt-4o-mini")
                .content("""
                        {"naturalLanguage": "Your runway is 12.0 months.",
                         "recommendations": [
                           {"type": "runway_optimization", "category": "cash", "title": "Extend runway", "impact": {"runway": "+2"}},
                           {"type": "runway_optimization", "category": "cash", "title": "Extend runway again", "impact": {"runway": "+2"}}
                         ],
                         "risks": ["Customer concentration"],
                         "warnings": ["Runway below 18 months"]}""")
                .promptTokens(900)
                .completionTokens(300)
                .totalTokens(1200)
                .build());

        worker.process("job-1", job(plan.getId()));

        AiCfoPlan stored = planRepository.findById(plan.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PlanStatus.COMPLETED);
        assertThat(stored.getPayload().getNaturalText()).isEqualTo("Your runway is 12.0 months.");
        assertThat(stored.getPayload().getRecommendations()).hasSize(1);
        assertThat(stored.getPayload().getRisks()).containsExactly("Customer concentration");
        assertThat(stored.getPayload().getWarnings()).containsExactly("Low intent confidence", "Runway below 18 months");
        assertThat(stored.getPayload().getMetadata()).containsEntry("modelUsed", "gpt-4o-mini");

        @SuppressWarnings("unchecked")
        List<String> promptIds = (List<String>) stored.getPayload().getMetadata().get("promptIds");
        assertThat(promptRepository.findById(promptIds.get(0))).hasValueSatisfying(prompt ->
                assertThat(prompt.getTokensIn()).isEqualTo(900));
    }

    @Test
    void malformedAnswerFailsPlan() {
        AiCfoPlan plan = queuedPlan();
        when(llmClient.call(any())).thenReturn(LlmResponse.builder().model("m").content("Sorry, I cannot help").build());

        worker.process("job-1", job(plan.getId()));

        AiCfoPlan stored = planRepository.findById(plan.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PlanStatus.FAILED);
        assertThat(stored.getPayload().getMetadata()).containsKey("error");
    }

    @Test
    void rateLimitFailsPlanAndStartsCooldown() {
        AiCfoPlan plan = queuedPlan();
        when(llmClient.call(any())).thenThrow(new LlmRateLimitedException("Too many requests", 429));

        worker.process("job-1", job(plan.getId()));

        assertThat(planRepository.findById(plan.getId()).orElseThrow().getStatus()).isEqualTo(PlanStatus.FAILED);
        assertThat(rateLimitState.isCoolingDown()).isTrue();
    }

    @Test
    void cooldownSkipsTheCall() {
        AiCfoPlan plan = queuedPlan();
        rateLimitState.recordRateLimit();

        worker.process("job-1", job(plan.getId()));

        verify(llmClient, never()).call(any());
        assertThat(planRepository.findById(plan.getId()).orElseThrow().getStatus()).isEqualTo(PlanStatus.FAILED);
    }

    @Test
    void lateResultDoesNotOverwriteFallbackDraft() {
        AiCfoPlan plan = queuedPlan();
        planRepository.update(plan.getId(), p -> p.toBuilder()
                .status(PlanStatus.DRAFT)
                .payload(p.getPayload().toBuilder().naturalText("Fallback answer").build())
                .build());
        when(llmClient.call(any())).thenReturn(LlmResponse.builder()
                .model("m").content("{\"naturalLanguage\": \"Late answer\"}").build());

        worker.process("job-1", job(plan.getId()));

        AiCfoPlan stored = planRepository.findById(plan.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PlanStatus.DRAFT);
        assertThat(stored.getPayload().getNaturalText()).isEqualTo("Fallback answer");
    }

    private AiCfoPlan queuedPlan() {
        return planRepository.save(AiCfoPlan.builder()
                .orgId(ORG_ID)
                .name("AI-CFO: What is our runway?")
                .status(PlanStatus.QUEUED)
                .payload(PlanPayload.builder()
                        .goal("What is our runway?")
                        .warnings(List.of("Low intent confidence"))
                        .metadata(Map.of("requestId", "req-1"))
                        .build())
                .build());
    }

    private static AiGenerationJob job(String planId) {
        return AiGenerationJob.builder()
                .planId(planId)
                .orgId(ORG_ID)
                .userId("9b8a7c6d-5e4f-4a3b-9c2d-1e0f9a8b7c61")
                .query("What is our runway?")
                .intent(IntentType.RUNWAY_CALCULATION)
                .calculations(Map.of("runway", 12.0))
                .evidence(List.of())
                .build();
    }
}
