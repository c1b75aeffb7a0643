package com.cfoPilot.aiCfo.gateway.service;

import com.cfoPilot.aiCfo.gateway.dto.AgenticQueryRequest;
import com.cfoPilot.aiCfo.gateway.dto.ApplyPlanRequest;
import com.cfoPilot.aiCfo.gateway.dto.ApplyPlanResponse;
import com.cfoPilot.aiCfo.gateway.dto.GeneratePlanRequest;
import com.cfoPilot.aiCfo.gateway.exception.ForbiddenException;
import com.cfoPilot.aiCfo.gateway.exception.InvalidInputException;
import com.cfoPilot.aiCfo.gateway.exception.NotFoundException;
import com.cfoPilot.aiCfo.gateway.model.RequestContext;
import com.cfoPilot.aiCfo.job.JobQueue;
import com.cfoPilot.aiCfo.orchestrator.service.QueryPipelineService;
import com.cfoPilot.aiCfo.repository.memory.InMemoryAuditLogRepository;
import com.cfoPilot.aiCfo.repository.memory.InMemoryFinancialStore;
import com.cfoPilot.aiCfo.repository.memory.InMemoryPlanRepository;
import com.cfoPilot.aiCfo.repository.memory.InMemoryPromptRepository;
import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.AuditLogEntry;
import com.cfoPilot.aiCfo.repository.model.ModelRun;
import com.cfoPilot.aiCfo.repository.model.ModelRunStatus;
import com.cfoPilot.aiCfo.repository.model.PlanPayload;
import com.cfoPilot.aiCfo.repository.model.PlanStatus;
import com.cfoPilot.aiCfo.repository.model.PromptRecord;
import com.cfoPilot.aiCfo.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AiCfoServiceTest {

    private static final String ORG_ID = "3f2a9c1e-8b4d-4f6a-a1c2-9e7d5b3a1c90";
    private static final String FINANCE_USER = "1c2d3e4f-5a6b-4c7d-8e9f-0a1b2c3d4e52";
    private static final String VIEWER_USER = "4d5e6f70-8192-4a3b-b4c5-d6e7f8091a23";
    private static final String STRANGER = "0f0e0d0c-0b0a-4909-8807-060504030201";
    private static final String BASELINE_RUN = "5a6b7c8d-1e2f-4a3b-8c4d-5e6f7a8b9c01";

    private QueryPipelineService queryPipelineService;
    private JobQueue jobQueue;
    private InMemoryFinancialStore store;
    private InMemoryPlanRepository planRepository;
    private InMemoryAuditLogRepository auditLogRepository;
    private InMemoryPromptRepository promptRepository;
    private AiCfoService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-10-01T10:00:00Z"));
        queryPipelineService = mock(QueryPipelineService.class);
        jobQueue = mock(JobQueue.class);
        store = new InMemoryFinancialStore(clock, true);
        planRepository = new InMemoryPlanRepository(clock);
        auditLogRepository = new InMemoryAuditLogRepository(clock);
        promptRepository = new InMemoryPromptRepository(clock);
        service = new AiCfoService(new RequestIdService(), queryPipelineService, store, planRepository,
                promptRepository, store, auditLogRepository, jobQueue, clock);
    }

    @Test
    void generatePlanSanitizesGoalAndRunsPipeline() {
        AiCfoPlan stored = storedPlan();
        when(queryPipelineService.run(any())).thenReturn(stored);

        AiCfoPlan plan = service.generatePlan(ORG_ID, FINANCE_USER, GeneratePlanRequest.builder()
                .goal("  Extend   runway\tto 18 months ")
                .modelRunId(" ")
                .build());

        assertThat(plan).isSameAs(stored);
        ArgumentCaptor<RequestContext> captor = ArgumentCaptor.forClass(RequestContext.class);
        verify(queryPipelineService).run(captor.capture());
        RequestContext context = captor.getValue();
        assertThat(context.getQuery()).isEqualTo("Extend runway to 18 months");
        assertThat(context.getModelRunId()).isNull();
        assertThat(context.getRequestId()).isNotBlank();
        assertThat(context.getConstraints()).isEmpty();
    }

    @Test
    void generatePlanRejectsMissingOrMalformedUser() {
        GeneratePlanRequest request = GeneratePlanRequest.builder().goal("Reduce burn").build();

        assertThatThrownBy(() -> service.generatePlan(ORG_ID, null, request))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("userId is required");
        assertThatThrownBy(() -> service.generatePlan(ORG_ID, "not-a-uuid", request))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Invalid userId format");
        assertThatThrownBy(() -> service.generatePlan("org-1", FINANCE_USER, request))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Invalid orgId format");
        verify(queryPipelineService, never()).run(any());
    }

    @Test
    void generatePlanIsClosedToViewersAndOutsiders() {
        GeneratePlanRequest request = GeneratePlanRequest.builder().goal("Reduce burn").build();

        assertThatThrownBy(() -> service.generatePlan(ORG_ID, VIEWER_USER, request))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Only admins and finance users can generate AI-CFO plans");
        assertThatThrownBy(() -> service.generatePlan(ORG_ID, STRANGER, request))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void generatePlanRejectsGoalWithNothingPrintable() {
        GeneratePlanRequest request = GeneratePlanRequest.builder().goal("\u0000\u0007  ").build();

        assertThatThrownBy(() -> service.generatePlan(ORG_ID, FINANCE_USER, request))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Goal is required");
    }

    @Test
    void agenticQuerySplitsModelRunFromConstraints() {
        AiCfoPlan stored = storedPlan();
        when(queryPipelineService.run(any())).thenReturn(stored);

        var response = service.processAgenticQuery(ORG_ID, VIEWER_USER, AgenticQueryRequest.builder()
                .query("What is our runway?")
                .context(Map.of("modelRunId", BASELINE_RUN, "targetRunwayMonths", 18))
                .build());

        assertThat(response.getPlanId()).isEqualTo(stored.getId());
        ArgumentCaptor<RequestContext> captor = ArgumentCaptor.forClass(RequestContext.class);
        verify(queryPipelineService).run(captor.capture());
        assertThat(captor.getValue().getModelRunId()).isEqualTo(BASELINE_RUN);
        assertThat(captor.getValue().getConstraints()).containsOnlyKeys("targetRunwayMonths");
    }

    @Test
    void listPlansValidatesStatusFilter() {
        storedPlan();

        assertThat(service.listPlans(ORG_ID, VIEWER_USER, "draft")).hasSize(1);
        assertThat(service.listPlans(ORG_ID, VIEWER_USER, "completed")).isEmpty();
        assertThatThrownBy(() -> service.listPlans(ORG_ID, VIEWER_USER, "archived"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("Invalid status: archived");
    }

    @Test
    void getPlanReportsUnknownPlan() {
        String missing = "aaaaaaaa-bbbb-4ccc-8ddd-eeeeeeeeeeee";

        assertThatThrownBy(() -> service.getPlan(missing, VIEWER_USER))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("AI-CFO plan not found: " + missing);
    }

    @Test
    void applyPlanQueuesScenarioRunOnLatestBaseline() {
        AiCfoPlan plan = storedPlan();

        ApplyPlanResponse response = service.applyPlan(plan.getId(), FINANCE_USER,
                new ApplyPlanRequest(Map.of("revenueGrowth", 0.1)));

        ModelRun run = store.findRunById(response.getModelRunId()).orElseThrow();
        assertThat(run.getStatus()).isEqualTo(ModelRunStatus.QUEUED);
        assertThat(run.getRunType()).isEqualTo("scenario");
        assertThat(run.getOverrides()).containsEntry("revenueGrowth", 0.1);
        verify(jobQueue).enqueueModelRun(eq(ORG_ID), eq(run.getId()));

        List<AuditLogEntry> audit = auditLogRepository.findRecent(ORG_ID, List.of("model_run_created"), 10);
        assertThat(audit).singleElement().satisfies(entry -> {
            assertThat(entry.getObjectId()).isEqualTo(run.getId());
            assertThat(entry.getMeta()).containsEntry("baseRunId", BASELINE_RUN);
        });
    }

    @Test
    void applyPlanIsClosedToViewers() {
        AiCfoPlan plan = storedPlan();

        assertThatThrownBy(() -> service.applyPlan(plan.getId(), VIEWER_USER, null))
                .isInstanceOf(ForbiddenException.class);
        verify(jobQueue, never()).enqueueModelRun(any(), any());
    }

    @Test
    void syntheticPromptIdsHaveNoRecord() {
        assertThat(service.getPrompt("deterministic_audit_1700000000000_3f2a9c1e", VIEWER_USER)).isEmpty();
    }

    @Test
    void promptIsReadableByMembersOfItsOrg() {
        PromptRecord prompt = storedPrompt();

        assertThat(service.getPrompt(prompt.getId(), VIEWER_USER))
                .hasValueSatisfying(found -> assertThat(found.getResponseText()).isEqualTo("Runway is 15.0 months."));
    }

    @Test
    void promptIsHiddenFromUsersOutsideItsOrg() {
        PromptRecord prompt = storedPrompt();

        assertThatThrownBy(() -> service.getPrompt(prompt.getId(), STRANGER))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("No access to this prompt");
    }

    @Test
    void promptLookupRequiresUser() {
        PromptRecord prompt = storedPrompt();

        assertThatThrownBy(() -> service.getPrompt(prompt.getId(), null))
                .isInstanceOf(InvalidInputException.class)
                .hasMessage("userId is required");
    }

    private PromptRecord storedPrompt() {
        return promptRepository.save(PromptRecord.builder()
                .orgId(ORG_ID)
                .userId(FINANCE_USER)
                .modelUsed("gpt-4o-mini")
                .systemPrompt("You are a CFO.")
                .userPrompt("What is our runway?")
                .responseText("Runway is 15.0 months.")
                .build());
    }

    private AiCfoPlan storedPlan() {
        return planRepository.save(AiCfoPlan.builder()
                .orgId(ORG_ID)
                .createdById(FINANCE_USER)
                .name("AI-CFO: Extend runway")
                .status(PlanStatus.DRAFT)
                .payload(PlanPayload.builder().goal("Extend runway").build())
                .build());
    }
}
