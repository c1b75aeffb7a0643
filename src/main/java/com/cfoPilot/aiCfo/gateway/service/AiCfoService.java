package com.cfoPilot.aiCfo.gateway.service;

import com.cfoPilot.aiCfo.gateway.dto.AgenticQueryRequest;
import com.cfoPilot.aiCfo.gateway.dto.AgenticQueryResponse;
import com.cfoPilot.aiCfo.gateway.dto.ApplyPlanRequest;
import com.cfoPilot.aiCfo.gateway.dto.ApplyPlanResponse;
import com.cfoPilot.aiCfo.gateway.dto.GeneratePlanRequest;
import com.cfoPilot.aiCfo.gateway.exception.ForbiddenException;
import com.cfoPilot.aiCfo.gateway.exception.InvalidInputException;
import com.cfoPilot.aiCfo.gateway.exception.NotFoundException;
import com.cfoPilot.aiCfo.gateway.model.RequestContext;
import com.cfoPilot.aiCfo.gateway.util.IdMasker;
import com.cfoPilot.aiCfo.gateway.util.InputSanitizer;
import com.cfoPilot.aiCfo.job.JobQueue;
import com.cfoPilot.aiCfo.orchestrator.service.QueryPipelineService;
import com.cfoPilot.aiCfo.repository.AuditLogRepository;
import com.cfoPilot.aiCfo.repository.FinancialModelRepository;
import com.cfoPilot.aiCfo.repository.OrgRoleRepository;
import com.cfoPilot.aiCfo.repository.PlanRepository;
import com.cfoPilot.aiCfo.repository.PromptRepository;
import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.AuditLogEntry;
import com.cfoPilot.aiCfo.repository.model.ModelRun;
import com.cfoPilot.aiCfo.repository.model.ModelRunStatus;
import com.cfoPilot.aiCfo.repository.model.PlanStatus;
import com.cfoPilot.aiCfo.repository.model.PromptRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * AI-CFO gateway service - handles all business logic in front of the query pipeline.
 *
 * Responsibilities:
 * - Validate ids (UUIDs) and the acting user's role in the org
 * - Sanitize the goal text
 * - Generate the requestId and hand the request to the pipeline
 * - Plan management: list, get, apply; prompt lookup
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AiCfoService {

    static final Set<String> PLANNING_ROLES = Set.of("admin", "finance");
    static final Set<String> QUERY_ROLES = Set.of("admin", "finance", "viewer");

    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final RequestIdService requestIdService;
    private final QueryPipelineService queryPipelineService;
    private final OrgRoleRepository orgRoleRepository;
    private final PlanRepository planRepository;
    private final PromptRepository promptRepository;
    private final FinancialModelRepository financialModelRepository;
    private final AuditLogRepository auditLogRepository;
    private final JobQueue jobQueue;
    private final Clock clock;

    /**
     * Generates a plan for a goal.
     *
     * @throws InvalidInputException for malformed ids or an empty goal
     * @throws ForbiddenException unless the user is admin or finance in the org
     */
    public AiCfoPlan generatePlan(String orgId, String userIdHeader, GeneratePlanRequest request) {
        String userId = requireUuid(userIdHeader, "userId");
        requireUuid(orgId, "orgId");
        if (request.getModelRunId() != null && !request.getModelRunId().isBlank()) {
            requireUuid(request.getModelRunId(), "modelRunId");
        }
        requireRole(orgId, userId, PLANNING_ROLES, "Only admins and finance users can generate AI-CFO plans");
        String goal = requireGoal(request.getGoal());

        RequestContext context = createRequestContext(orgId, userId, goal,
                blankToNull(request.getModelRunId()), request.getConstraints());
        log.info("Plan request received - requestId: {}, orgId: {}, userId: {}, goalLength: {}",
                context.getRequestId(), IdMasker.mask(orgId), IdMasker.mask(userId), goal.length());
        return queryPipelineService.run(context);
    }

    /**
     * Answers a query and returns the agent trace of the stored plan.
     */
    public AgenticQueryResponse processAgenticQuery(String orgId, String userIdHeader, AgenticQueryRequest request) {
        long start = clock.millis();
        String userId = requireUuid(userIdHeader, "userId");
        requireUuid(orgId, "orgId");
        requireRole(orgId, userId, QUERY_ROLES, "No access to this organization");
        String query = requireGoal(request.getQuery());

        Map<String, Object> constraints = new HashMap<>();
        String modelRunId = null;
        if (request.getContext() != null) {
            constraints.putAll(request.getContext());
            Object run = constraints.remove("modelRunId");
            if (run instanceof String runId && !runId.isBlank()) {
                modelRunId = requireUuid(runId, "modelRunId");
            }
        }

        RequestContext context = createRequestContext(orgId, userId, query, modelRunId, constraints);
        log.info("Agentic query received - requestId: {}, orgId: {}, userId: {}",
                context.getRequestId(), IdMasker.mask(orgId), IdMasker.mask(userId));
        AiCfoPlan plan = queryPipelineService.run(context);

        return AgenticQueryResponse.builder()
                .planId(plan.getId())
                .response(plan.getPayload().getAgentTrace())
                .processingTimeMs(clock.millis() - start)
                .build();
    }

    /**
     * Plans of the org, newest first.
     *
     * @param status Optional status filter (wire name)
     */
    public List<AiCfoPlan> listPlans(String orgId, String userIdHeader, String status) {
        String userId = requireUuid(userIdHeader, "userId");
        requireUuid(orgId, "orgId");
        requireRole(orgId, userId, QUERY_ROLES, "No access to this organization");
        PlanStatus filter = null;
        if (status != null && !status.isBlank()) {
            filter = PlanStatus.fromWire(status)
                    .orElseThrow(() -> new InvalidInputException("Invalid status: " + status));
        }
        return planRepository.findByOrg(orgId, filter);
    }

    /**
     * @throws NotFoundException when the plan does not exist
     */
    public AiCfoPlan getPlan(String planId, String userIdHeader) {
        String userId = requireUuid(userIdHeader, "userId");
        requireUuid(planId, "planId");
        AiCfoPlan plan = planRepository.findById(planId)
                .orElseThrow(() -> new NotFoundException("AI-CFO plan not found: " + planId));
        requireRole(plan.getOrgId(), userId, QUERY_ROLES, "No access to this plan");
        return plan;
    }

    /**
     * Creates a queued scenario run from the plan's base run with {@code changes} merged over its overrides.
     */
    public ApplyPlanResponse applyPlan(String planId, String userIdHeader, ApplyPlanRequest request) {
        String userId = requireUuid(userIdHeader, "userId");
        requireUuid(planId, "planId");
        AiCfoPlan plan = planRepository.findById(planId)
                .orElseThrow(() -> new NotFoundException("AI-CFO plan not found: " + planId));
        String orgId = plan.getOrgId();
        requireRole(orgId, userId, PLANNING_ROLES, "Only admins and finance users can apply AI-CFO plans");

        Optional<ModelRun> baseRun = plan.getModelRunId() != null
                ? financialModelRepository.findRunById(plan.getModelRunId())
                : Optional.empty();
        if (baseRun.isEmpty()) {
            baseRun = financialModelRepository.findLatestCompletedRun(orgId);
        }
        ModelRun base = baseRun.orElseThrow(() ->
                new InvalidInputException("No model run available to apply plan " + planId));

        Map<String, Object> overrides = new LinkedHashMap<>();
        if (base.getOverrides() != null) {
            overrides.putAll(base.getOverrides());
        }
        if (request != null && request.getChanges() != null) {
            overrides.putAll(request.getChanges());
        }

        ModelRun run = financialModelRepository.saveRun(ModelRun.builder()
                .id(UUID.randomUUID().toString())
                .modelId(base.getModelId())
                .orgId(orgId)
                .runType("scenario")
                .status(ModelRunStatus.QUEUED)
                .overrides(overrides)
                .createdAt(clock.instant())
                .build());
        jobQueue.enqueueModelRun(orgId, run.getId());

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("planId", planId);
        meta.put("baseRunId", base.getId());
        auditLogRepository.append(AuditLogEntry.builder()
                .orgId(orgId)
                .actorUserId(userId)
                .action("model_run_created")
                .objectType("model_run")
                .objectId(run.getId())
                .meta(meta)
                .build());

        log.info("Plan applied - planId: {}, modelRunId: {}, orgId: {}", planId, run.getId(), IdMasker.mask(orgId));
        return new ApplyPlanResponse(run.getId());
    }

    /**
     * Prompt record behind a plan. Synthetic ids (deterministic answers) have no record.
     *
     * @throws ForbiddenException unless the user has a role in the prompt's org
     */
    public Optional<PromptRecord> getPrompt(String promptId, String userIdHeader) {
        String userId = requireUuid(userIdHeader, "userId");
        if (promptId == null || !UUID_PATTERN.matcher(promptId).matches()) {
            return Optional.empty();
        }
        Optional<PromptRecord> prompt = promptRepository.findById(promptId);
        prompt.ifPresent(record -> requireRole(record.getOrgId(), userId, QUERY_ROLES, "No access to this prompt"));
        return prompt;
    }

    private RequestContext createRequestContext(String orgId, String userId, String query, String modelRunId,
                                                Map<String, Object> constraints) {
        return RequestContext.builder()
                .orgId(orgId)
                .userId(userId)
                .requestId(requestIdService.generateRequestId())
                .query(query)
                .modelRunId(modelRunId)
                .constraints(constraints == null ? Map.of() : constraints)
                .receivedAt(clock.instant())
                .build();
    }

    private void requireRole(String orgId, String userId, Set<String> allowed, String message) {
        Optional<String> role = orgRoleRepository.findRole(orgId, userId);
        if (role.isEmpty() || !allowed.contains(role.get())) {
            log.warn("Access denied - orgId: {}, userId: {}, role: {}",
                    IdMasker.mask(orgId), IdMasker.mask(userId), role.orElse("none"));
            throw new ForbiddenException(message);
        }
    }

    private static String requireGoal(String goal) {
        String sanitized = InputSanitizer.sanitize(goal);
        if (sanitized.isEmpty()) {
            throw new InvalidInputException("Goal is required");
        }
        return sanitized;
    }

    private static String requireUuid(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(name + " is required");
        }
        if (!UUID_PATTERN.matcher(value.trim()).matches()) {
            throw new InvalidInputException("Invalid " + name + " format");
        }
        return value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
