package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.config.MdcAwareExecutor;
import com.cfoPilot.aiCfo.gateway.model.RequestContext;
import com.cfoPilot.aiCfo.gateway.util.IdMasker;
import com.cfoPilot.aiCfo.job.AiGenerationJob;
import com.cfoPilot.aiCfo.job.JobQueue;
import com.cfoPilot.aiCfo.llm.client.LlmClient;
import com.cfoPilot.aiCfo.orchestrator.model.AgentTrace;
import com.cfoPilot.aiCfo.orchestrator.model.DegradedReason;
import com.cfoPilot.aiCfo.orchestrator.model.ExecutionResult;
import com.cfoPilot.aiCfo.orchestrator.model.FinancialContext;
import com.cfoPilot.aiCfo.orchestrator.model.GroundingContext;
import com.cfoPilot.aiCfo.orchestrator.model.GroundingValidation;
import com.cfoPilot.aiCfo.orchestrator.model.IntentClassification;
import com.cfoPilot.aiCfo.orchestrator.model.OrchestrationState;
import com.cfoPilot.aiCfo.orchestrator.model.PipelineStage;
import com.cfoPilot.aiCfo.orchestrator.model.PlannerResult;
import com.cfoPilot.aiCfo.orchestrator.model.Recommendation;
import com.cfoPilot.aiCfo.orchestrator.model.ResponseValidation;
import com.cfoPilot.aiCfo.orchestrator.model.StageResult;
import com.cfoPilot.aiCfo.orchestrator.model.StructuredResponse;
import com.cfoPilot.aiCfo.repository.AuditLogRepository;
import com.cfoPilot.aiCfo.repository.ConnectorRepository;
import com.cfoPilot.aiCfo.repository.OverviewMetricsProvider;
import com.cfoPilot.aiCfo.repository.PlanRepository;
import com.cfoPilot.aiCfo.repository.TransactionRepository;
import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.AuditLogEntry;
import com.cfoPilot.aiCfo.repository.model.OverviewMetrics;
import com.cfoPilot.aiCfo.repository.model.PlanPayload;
import com.cfoPilot.aiCfo.repository.model.PlanStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Query pipeline service - workflow owner and coordinator.
 *
 * Workflow steps:
 * META_QUERY? -> CLASSIFYING (with connector, transaction and overview lookups in parallel)
 * -> GROUNDING -> PLANNING -> (EXECUTING | BLOCKED_FOR_APPROVAL) -> AI generation
 * -> RESPONSE_READY, escaping to FALLBACK_REASONING whenever the AI answer is unavailable.
 *
 * Upstream failures never reach the caller; they degrade the answer to the deterministic reasoner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryPipelineService {

    static final String DETERMINISTIC = "deterministic";
    private static final String MDC_REQUEST_ID = "requestId";
    private static final int PLAN_NAME_CHARS = 60;

    private final IntentClassifierService intentClassifierService;
    private final GroundingService groundingService;
    private final ActionPlannerService actionPlannerService;
    private final ActionExecutorService actionExecutorService;
    private final ResponseAssemblerService responseAssemblerService;
    private final CfoBrainService cfoBrainService;
    private final MetaQueryRouter metaQueryRouter;
    private final AgentTraceBuilder agentTraceBuilder;
    private final RateLimitState rateLimitState;
    private final LlmClient llmClient;
    private final JobQueue jobQueue;
    private final PlanRepository planRepository;
    private final AuditLogRepository auditLogRepository;
    private final ConnectorRepository connectorRepository;
    private final TransactionRepository transactionRepository;
    private final OverviewMetricsProvider overviewMetricsProvider;
    private final MdcAwareExecutor pipelineExecutor;
    private final Clock clock;

    @Value("${ai-cfo.pipeline.poll-interval:500ms}")
    private Duration pollInterval = Duration.ofMillis(500);

    @Value("${ai-cfo.pipeline.poll-max-attempts:40}")
    private int pollMaxAttempts = 40;

    /**
     * Bound on the classification call and each context lookup run alongside it.
     */
    @Value("${ai-cfo.pipeline.context-timeout:5s}")
    private Duration contextTimeout = Duration.ofSeconds(5);

    /**
     * Runs one goal or query through the pipeline and returns the persisted plan.
     *
     * @param requestContext Sanitized query, org, user and request id
     * @return the stored plan; {@code completed} for AI and meta answers, {@code draft} for fallback answers
     */
    public AiCfoPlan run(RequestContext requestContext) {
        String requestId = requestContext.getRequestId();
        MDC.put(MDC_REQUEST_ID, requestId);
        long start = clock.millis();
        log.info("Starting pipeline - requestId: {}, orgId: {}, userId: {}", requestId,
                IdMasker.mask(requestContext.getOrgId()), IdMasker.mask(requestContext.getUserId()));

        try {
            Optional<MetaQueryRouter.MetaQuery> metaQuery = metaQueryRouter.detect(requestContext.getQuery());
            if (metaQuery.isPresent()) {
                return answerMetaQuery(requestContext, metaQuery.get());
            }

            OrchestrationState state = OrchestrationState.builder()
                    .requestContext(requestContext)
                    .build();

            // Step 1: CLASSIFYING, with the context lookups fanned out alongside
            classifyAndLoadContext(state);

            // Step 2: GROUNDING
            state.setGrounding(stage(state, PipelineStage.GROUNDING, () -> retrieveGrounding(state)));

            // Step 3: PLANNING
            seedOverviewCalculations(state);
            state.setPlannerResult(stage(state, PipelineStage.PLANNING, () -> actionPlannerService.plan(
                    requestContext.getOrgId(), requestContext.getUserId(),
                    state.getClassification().getIntent(), state.getClassification().getSlots(),
                    requestContext.getModelRunId())));

            // Step 4: EXECUTING or BLOCKED_FOR_APPROVAL
            execute(state);

            // Step 5: assemble the structured response
            StructuredResponse response = responseAssemblerService.assemble(state.getClassification(),
                    state.getGrounding(), state.getPlannerResult(), state.getExecutionResults());
            ResponseValidation responseValidation = responseAssemblerService.validate(response);
            if (!responseValidation.isValid()) {
                log.debug("Structured response issues - requestId: {}, issues: {}",
                        requestId, responseValidation.getIssues());
            }
            state.setResponse(response);

            // Step 6: AI generation, or straight to the fallback
            AiCfoPlan plan = generate(state, start);

            state.setStage(PipelineStage.RESPONSE_READY);
            log.info("Pipeline completed - requestId: {}, planId: {}, status: {}, degraded: {}, elapsed: {}ms",
                    requestId, plan.getId(), plan.getStatus(), state.getDegradedReason(), clock.millis() - start);
            return plan;
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    private AiCfoPlan answerMetaQuery(RequestContext requestContext, MetaQueryRouter.MetaQuery metaQuery) {
        log.info("Meta-query detected - requestId: {}, type: {}", requestContext.getRequestId(), metaQuery);
        long liveConnectors = metaQuery == MetaQueryRouter.MetaQuery.CONNECT_ACCOUNTING
                ? connectorRepository.countLive(requestContext.getOrgId())
                : 0;
        MetaQueryRouter.MetaAnswer answer = metaQueryRouter.answer(metaQuery, liveConnectors);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("modelUsed", DETERMINISTIC);
        metadata.put("intent", answer.intentLabel());
        PlanPayload payload = PlanPayload.builder()
                .goal(requestContext.getQuery())
                .constraints(requestContext.getConstraints())
                .intent(answer.intentLabel())
                .naturalText(answer.text())
                .recommendations(List.of())
                .calculations(Map.of())
                .warnings(List.of())
                .metadata(metadata)
                .generatedAt(clock.instant())
                .build();
        payload.setAgentTrace(AgentTrace.builder()
                .answer(answer.text())
                .intent(answer.intentLabel())
                .confidence(1.0)
                .thoughts(List.of(new AgentTrace.Thought(1, "Recognize the request", answer.description())))
                .dataSources(List.of())
                .calculations(Map.of())
                .recommendations(List.of())
                .followUpQuestions(AgentTraceBuilder.followUpQuestions(null))
                .build());

        AiCfoPlan plan = planRepository.save(AiCfoPlan.builder()
                .orgId(requestContext.getOrgId())
                .modelRunId(requestContext.getModelRunId())
                .createdById(requestContext.getUserId())
                .name(answer.name())
                .description(answer.description())
                .status(PlanStatus.COMPLETED)
                .payload(payload)
                .build());
        auditPlan(requestContext, plan);
        return plan;
    }

    private void classifyAndLoadContext(OrchestrationState state) {
        RequestContext requestContext = state.getRequestContext();
        String orgId = requestContext.getOrgId();
        String query = requestContext.getQuery();

        stage(state, PipelineStage.CLASSIFYING, () -> {
            CompletableFuture<StageResult<IntentClassification>> classification = CompletableFuture
                    .supplyAsync(() -> intentClassifierService.classify(query), pipelineExecutor)
                    .orTimeout(contextTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .handle((result, e) -> {
                        if (e == null) {
                            return StageResult.success(result);
                        }
                        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                        return cause instanceof TimeoutException
                                ? StageResult.<IntentClassification>degraded(DegradedReason.STAGE_ERROR,
                                        "classification timed out after " + contextTimeout.toMillis() + "ms")
                                : StageResult.<IntentClassification>degraded(DegradedReason.STAGE_ERROR,
                                        cause.getMessage());
                    });
            CompletableFuture<Long> connectors = lookup(() -> connectorRepository.countLive(orgId), 0L, "connectors");
            CompletableFuture<Long> transactions = lookup(() -> transactionRepository.count(orgId), 0L, "transactions");
            CompletableFuture<Optional<OverviewMetrics>> overview =
                    lookup(() -> overviewMetricsProvider.getOverview(orgId), Optional.empty(), "overview");

            CompletableFuture.allOf(classification, connectors, transactions, overview).join();

            StageResult<IntentClassification> classified = classification.join();
            if (!classified.isSuccess()) {
                state.degrade(classified.getReason(), classified.getDetail());
            }
            state.setClassification(classified.isSuccess()
                    ? classified.getValue()
                    : intentClassifierService.classifyWithPatterns(query));
            state.setHasConnectedAccounting(connectors.join() > 0);
            state.setTransactionCount(transactions.join());
            state.setOverview(overview.join().orElse(null));
            return state.getClassification();
        });

        IntentClassification classification = state.getClassification();
        if (intentClassifierService.validate(classification).isRequiresClarification()) {
            log.info("Low-confidence classification - requestId: {}, intent: {}, confidence: {}",
                    requestContext.getRequestId(), classification.getIntent().getWireName(),
                    classification.getConfidence());
        }
    }

    private GroundingContext retrieveGrounding(OrchestrationState state) {
        RequestContext requestContext = state.getRequestContext();
        try {
            GroundingContext grounding = groundingService.retrieve(requestContext.getOrgId(),
                    state.getClassification().getIntent(), state.getClassification().getSlots());
            GroundingValidation validation =
                    groundingService.validateGrounding(grounding, GroundingService.DEFAULT_MIN_EVIDENCE);
            if (!validation.isSufficient()) {
                log.debug("Grounding insufficient - requestId: {}, issues: {}",
                        requestContext.getRequestId(), validation.getIssues());
            }
            return grounding;
        } catch (RuntimeException e) {
            log.warn("Grounding failed - requestId: {}, continuing without evidence", requestContext.getRequestId(), e);
            state.degrade(DegradedReason.STAGE_ERROR, "grounding: " + e.getMessage());
            return GroundingContext.empty();
        }
    }

    /**
     * Overview figures go in first so that execution results override them.
     */
    private void seedOverviewCalculations(OrchestrationState state) {
        OverviewMetrics overview = state.getOverview();
        if (overview == null) {
            return;
        }
        Map<String, Double> calculations = state.getCalculations();
        putIfPresent(calculations, "revenue", overview.getMonthlyRevenue());
        putIfPresent(calculations, "burnRate", overview.getMonthlyBurnRate());
        putIfPresent(calculations, "runway", overview.getCashRunway());
        putIfPresent(calculations, "growth", overview.getRevenueGrowth());
        putIfPresent(calculations, "healthScore", overview.getHealthScore());
        if (overview.getActiveCustomers() != null) {
            calculations.put("customers", overview.getActiveCustomers().doubleValue());
        }
    }

    private void execute(OrchestrationState state) {
        RequestContext requestContext = state.getRequestContext();
        PlannerResult plannerResult = state.getPlannerResult();

        if (plannerResult.isRequiresApproval()) {
            state.setStage(PipelineStage.BLOCKED_FOR_APPROVAL);
            log.info("Execution blocked for approval - requestId: {}", requestContext.getRequestId());
            return;
        }
        if (!plannerResult.getValidation().isOk() || plannerResult.getActions().isEmpty()) {
            log.debug("Nothing to execute - requestId: {}, issues: {}",
                    requestContext.getRequestId(), plannerResult.getValidation().getIssues());
            return;
        }

        List<ExecutionResult> results = stage(state, PipelineStage.EXECUTING, () -> {
            try {
                return actionExecutorService.execute(requestContext.getOrgId(), requestContext.getUserId(),
                        plannerResult.getActions(), requestContext.getModelRunId());
            } catch (RuntimeException e) {
                log.warn("Execution failed - requestId: {}", requestContext.getRequestId(), e);
                state.degrade(DegradedReason.STAGE_ERROR, "execution: " + e.getMessage());
                return List.of();
            }
        });
        state.getExecutionResults().addAll(results);
        for (ExecutionResult result : results) {
            if (!result.hasValue()) {
                continue;
            }
            if (result.getOperation().getCategoryKey() != null) {
                state.getCalculations().put(result.getOperation().getCategoryKey(), result.getValue());
            }
            state.getCalculations().put(result.getOperation().getWireName(), result.getValue());
        }
    }

    private AiCfoPlan generate(OrchestrationState state, long start) {
        RequestContext requestContext = state.getRequestContext();

        if (rateLimitState.isCoolingDown()) {
            state.degrade(DegradedReason.RATE_LIMITED, "cooldown %ss remaining".formatted(
                    rateLimitState.remaining().toSeconds()));
            return fallback(state, null, start);
        }
        if (!llmClient.isConfigured()) {
            state.degrade(DegradedReason.LLM_NOT_CONFIGURED, null);
            return fallback(state, null, start);
        }

        AiCfoPlan queued = planRepository.save(AiCfoPlan.builder()
                .orgId(requestContext.getOrgId())
                .modelRunId(requestContext.getModelRunId())
                .createdById(requestContext.getUserId())
                .name(planName(requestContext.getQuery()))
                .description(requestContext.getQuery())
                .status(PlanStatus.QUEUED)
                .payload(PlanPayload.builder()
                        .goal(requestContext.getQuery())
                        .constraints(requestContext.getConstraints())
                        .intent(state.getClassification().getIntent().getWireName())
                        .calculations(Map.copyOf(state.getCalculations()))
                        .structuredResponse(state.getResponse())
                        .warnings(state.getResponse().getWarnings())
                        .metadata(baseMetadata(state, start))
                        .build())
                .build());

        String jobId = jobQueue.enqueueAiGeneration(AiGenerationJob.builder()
                .planId(queued.getId())
                .orgId(requestContext.getOrgId())
                .userId(requestContext.getUserId())
                .query(requestContext.getQuery())
                .intent(state.getClassification().getIntent())
                .calculations(Map.copyOf(state.getCalculations()))
                .evidence(state.getGrounding().getEvidence())
                .build());
        planRepository.update(queued.getId(), plan -> plan.toBuilder()
                .payload(plan.getPayload().toBuilder().jobId(jobId).build())
                .build());

        StageResult<AiCfoPlan> completed = awaitCompletion(queued.getId());
        if (!completed.isSuccess()) {
            state.degrade(completed.getReason(), completed.getDetail());
            return fallback(state, queued.getId(), start);
        }

        AiCfoPlan plan = completed.getValue();
        AiCfoPlan finished = planRepository.update(plan.getId(), stored -> {
            Map<String, Object> metadata = new LinkedHashMap<>(baseMetadata(state, start));
            if (stored.getPayload().getMetadata() != null) {
                metadata.putAll(stored.getPayload().getMetadata());
            }
            metadata.put("processingTimeMs", clock.millis() - start);
            PlanPayload payload = stored.getPayload().toBuilder()
                    .calculations(Map.copyOf(state.getCalculations()))
                    .metadata(metadata)
                    .build();
            payload.setAgentTrace(agentTraceBuilder.build(state, payload));
            return stored.toBuilder().payload(payload).build();
        }).orElse(plan);
        auditPlan(requestContext, finished);
        return finished;
    }

    /**
     * Polls the plan until the worker finishes or the attempts run out.
     */
    StageResult<AiCfoPlan> awaitCompletion(String planId) {
        for (int attempt = 1; attempt <= pollMaxAttempts; attempt++) {
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return StageResult.degraded(DegradedReason.WORKER_TIMEOUT, "interrupted while waiting");
            }
            Optional<AiCfoPlan> plan = planRepository.findById(planId);
            if (plan.isEmpty()) {
                return StageResult.degraded(DegradedReason.WORKER_FAILED, "plan disappeared");
            }
            PlanStatus status = plan.get().getStatus();
            if (status == PlanStatus.FAILED) {
                Object error = plan.get().getPayload().getMetadata() == null
                        ? null : plan.get().getPayload().getMetadata().get("error");
                return StageResult.degraded(DegradedReason.WORKER_FAILED, String.valueOf(error));
            }
            if (status == PlanStatus.COMPLETED) {
                return plan.get().getPayload().hasNaturalText()
                        ? StageResult.success(plan.get())
                        : StageResult.degraded(DegradedReason.MISSING_NATURAL_TEXT, null);
            }
        }
        return StageResult.degraded(DegradedReason.WORKER_TIMEOUT,
                "no result after %d attempts".formatted(pollMaxAttempts));
    }

    /**
     * Deterministic answer. Reuses the queued plan when one exists, otherwise creates a new one.
     */
    private AiCfoPlan fallback(OrchestrationState state, String queuedPlanId, long start) {
        RequestContext requestContext = state.getRequestContext();
        state.setStage(PipelineStage.FALLBACK_REASONING);
        log.info("Fallback reasoning - requestId: {}, reason: {}, detail: {}", requestContext.getRequestId(),
                state.getDegradedReason(), state.getDegradedDetail());

        FinancialContext context = cfoBrainService.resolveContext(
                state.getGrounding().getLatestSummary(), state.getOverview());
        List<Recommendation> recommendations = cfoBrainService.generate(requestContext.getQuery(),
                requestContext.getConstraints(), context, state.getClassification().getIntent());
        String naturalText = cfoBrainService.explain(requestContext.getQuery(),
                state.getClassification().getIntent(), recommendations, context, state.getCalculations());

        Map<String, Object> metadata = baseMetadata(state, start);
        metadata.put("modelUsed", DETERMINISTIC);
        metadata.put("promptIds", List.of(syntheticPromptId(requestContext.getOrgId())));
        metadata.put("degradedReason", state.getDegradedReason() != null ? state.getDegradedReason().name() : null);
        metadata.put("degradedDetail", state.getDegradedDetail());
        metadata.put("usedRealData", context.isHasRealData());
        metadata.put("processingTimeMs", clock.millis() - start);

        PlanPayload payload = PlanPayload.builder()
                .goal(requestContext.getQuery())
                .constraints(requestContext.getConstraints())
                .intent(state.getClassification().getIntent().getWireName())
                .naturalText(naturalText)
                .recommendations(recommendations)
                .calculations(Map.copyOf(state.getCalculations()))
                .risks(List.of())
                .warnings(state.getResponse().getWarnings())
                .structuredResponse(state.getResponse().toBuilder().recommendations(recommendations).build())
                .metadata(metadata)
                .generatedAt(clock.instant())
                .build();
        payload.setAgentTrace(agentTraceBuilder.build(state, payload));

        AiCfoPlan plan;
        if (queuedPlanId != null) {
            plan = planRepository.update(queuedPlanId, stored -> stored.toBuilder()
                            .status(PlanStatus.DRAFT)
                            .payload(payload.toBuilder().jobId(stored.getPayload().getJobId()).build())
                            .build())
                    .orElseGet(() -> saveDraft(requestContext, payload));
        } else {
            plan = saveDraft(requestContext, payload);
        }
        auditPlan(requestContext, plan);
        return plan;
    }

    private AiCfoPlan saveDraft(RequestContext requestContext, PlanPayload payload) {
        return planRepository.save(AiCfoPlan.builder()
                .orgId(requestContext.getOrgId())
                .modelRunId(requestContext.getModelRunId())
                .createdById(requestContext.getUserId())
                .name(planName(requestContext.getQuery()))
                .description(requestContext.getQuery())
                .status(PlanStatus.DRAFT)
                .payload(payload)
                .build());
    }

    private Map<String, Object> baseMetadata(OrchestrationState state, long start) {
        IntentClassification classification = state.getClassification();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("requestId", state.getRequestContext().getRequestId());
        metadata.put("intent", classification.getIntent().getWireName());
        metadata.put("intentConfidence", classification.getConfidence());
        metadata.put("classifierModel", classification.getModelUsed());
        metadata.put("processingTimeMs", clock.millis() - start);
        metadata.put("totalDataSources", state.getGrounding().getEvidence().size());
        metadata.put("groundingConfidence", state.getGrounding().getConfidence());
        metadata.put("hasConnectedAccounting", state.isHasConnectedAccounting());
        metadata.put("hasFinancialData", state.hasFinancialData());
        metadata.put("transactionCount", state.getTransactionCount());
        metadata.put("requiresApproval", state.getPlannerResult().isRequiresApproval());
        Map<String, Long> timings = new LinkedHashMap<>();
        state.getStageTimings().forEach((stage, millis) -> timings.put(stage.name(), millis));
        metadata.put("stageTimingsMs", timings);
        return metadata;
    }

    private void auditPlan(RequestContext requestContext, AiCfoPlan plan) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("requestId", requestContext.getRequestId());
        meta.put("status", plan.getStatus().getWireName());
        meta.put("intent", plan.getPayload() != null ? plan.getPayload().getIntent() : null);
        auditLogRepository.append(AuditLogEntry.builder()
                .orgId(requestContext.getOrgId())
                .actorUserId(requestContext.getUserId())
                .action("ai_plan_generated")
                .objectType("ai_cfo_plan")
                .objectId(plan.getId())
                .meta(meta)
                .build());
    }

    private <T> T stage(OrchestrationState state, PipelineStage stage, Supplier<T> body) {
        String requestId = state.getRequestContext().getRequestId();
        log.debug("Step {} - requestId: {}", stage, requestId);
        state.setStage(stage);
        long stageStart = clock.millis();
        T result = body.get();
        long elapsed = clock.millis() - stageStart;
        state.getStageTimings().put(stage, elapsed);
        log.info("Step {} completed - requestId: {}, elapsed: {}ms", stage, requestId, elapsed);
        return result;
    }

    private <T> CompletableFuture<T> lookup(Supplier<T> supplier, T fallback, String name) {
        return CompletableFuture.supplyAsync(supplier, pipelineExecutor)
                .orTimeout(contextTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    log.warn("Context lookup '{}' failed: {}", name, e.toString());
                    return fallback;
                });
    }

    private String syntheticPromptId(String orgId) {
        String org = orgId.length() > 8 ? orgId.substring(0, 8) : orgId;
        return "deterministic_audit_%d_%s".formatted(clock.millis(), org);
    }

    private static String planName(String query) {
        String trimmed = query.length() > PLAN_NAME_CHARS ? query.substring(0, PLAN_NAME_CHARS) + "..." : query;
        return "AI-CFO: " + trimmed;
    }

    private static void putIfPresent(Map<String, Double> calculations, String key, Double value) {
        if (value != null && !value.isNaN() && !value.isInfinite()) {
            calculations.put(key, value);
        }
    }
}
