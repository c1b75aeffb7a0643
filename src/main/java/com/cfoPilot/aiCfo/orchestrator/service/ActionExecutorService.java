package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.gateway.exception.ForbiddenException;
import com.cfoPilot.aiCfo.gateway.util.IdMasker;
import com.cfoPilot.aiCfo.job.JobQueue;
import com.cfoPilot.aiCfo.orchestrator.model.ActionParams;
import com.cfoPilot.aiCfo.orchestrator.model.ExecutionResult;
import com.cfoPilot.aiCfo.orchestrator.model.PlannerAction;
import com.cfoPilot.aiCfo.repository.AuditLogRepository;
import com.cfoPilot.aiCfo.repository.FinancialModelRepository;
import com.cfoPilot.aiCfo.repository.PlanRepository;
import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.AuditLogEntry;
import com.cfoPilot.aiCfo.repository.model.FinancialModel;
import com.cfoPilot.aiCfo.repository.model.ModelRun;
import com.cfoPilot.aiCfo.repository.model.ModelRunStatus;
import com.cfoPilot.aiCfo.repository.model.PlanPayload;
import com.cfoPilot.aiCfo.repository.model.PlanStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Action executor - runs planned actions.
 *
 * Calculations were already evaluated by the planner and are returned as values. Scenario,
 * Monte Carlo, assumption and recommendation actions go through persistence and the job queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionExecutorService {

    private final FinancialModelRepository financialModelRepository;
    private final PlanRepository planRepository;
    private final AuditLogRepository auditLogRepository;
    private final JobQueue jobQueue;
    private final GroundingCache groundingCache;
    private final Clock clock;

    /**
     * Executes every action in order.
     *
     * @throws ForbiddenException if any action still requires approval; nothing is executed in that case
     */
    public List<ExecutionResult> execute(String orgId, String userId, List<PlannerAction> actions, String modelRunId) {
        for (PlannerAction action : actions) {
            if (action.isRequiresApproval()) {
                throw new ForbiddenException("Action requires approval: " + action.getApprovalReason());
            }
        }

        List<ExecutionResult> results = new ArrayList<>();
        for (PlannerAction action : actions) {
            log.debug("Executing {} - orgId: {}", action.getOperation().getWireName(), IdMasker.mask(orgId));
            results.add(executeOne(orgId, userId, action.getParams(), modelRunId));
        }
        return results;
    }

    private ExecutionResult executeOne(String orgId, String userId, ActionParams params, String modelRunId) {
        if (params instanceof ActionParams.Scenario scenario) {
            return createScenario(orgId, userId, scenario, modelRunId);
        }
        if (params instanceof ActionParams.MonteCarlo monteCarlo) {
            return runMonteCarlo(orgId, monteCarlo);
        }
        if (params instanceof ActionParams.AssumptionChange change) {
            return updateAssumptions(orgId, userId, change);
        }
        if (params instanceof ActionParams.Recommendations recommendations) {
            return generateRecommendations(orgId, userId, recommendations, modelRunId);
        }
        return ExecutionResult.builder()
                .operation(params.operation())
                .params(params)
                .value(params.numericResult().isPresent() ? params.numericResult().getAsDouble() : null)
                .build();
    }

    private ExecutionResult createScenario(String orgId, String userId, ActionParams.Scenario scenario,
                                           String modelRunId) {
        Optional<String> modelId = resolveModelId(orgId, modelRunId);
        if (modelId.isEmpty()) {
            return message(scenario, "No financial model available for scenario");
        }

        Map<String, Object> overrides = new LinkedHashMap<>();
        overrides.put("scenarioType", scenario.scenarioType());
        if (scenario.revenueGrowth() != null) {
            overrides.put("revenueGrowth", scenario.revenueGrowth());
        }
        if (scenario.expenseChange() != null) {
            overrides.put("expenseChange", scenario.expenseChange());
        }
        if (scenario.headcountChange() != null) {
            overrides.put("headcountChange", scenario.headcountChange());
        }

        ModelRun run = financialModelRepository.saveRun(ModelRun.builder()
                .id(UUID.randomUUID().toString())
                .modelId(modelId.get())
                .orgId(orgId)
                .runType("scenario")
                .status(ModelRunStatus.QUEUED)
                .overrides(overrides)
                .createdAt(clock.instant())
                .build());
        jobQueue.enqueueModelRun(orgId, run.getId());
        audit(orgId, userId, "model_run_created", "model_run", run.getId(), overrides);

        return ExecutionResult.builder()
                .operation(scenario.operation())
                .params(scenario)
                .referenceId(run.getId())
                .message("Scenario run queued")
                .build();
    }

    private ExecutionResult runMonteCarlo(String orgId, ActionParams.MonteCarlo monteCarlo) {
        Optional<FinancialModel> model = financialModelRepository.findLatestModel(orgId);
        if (model.isEmpty()) {
            return message(monteCarlo, "No financial model available for Monte Carlo");
        }
        String jobId = jobQueue.enqueueMonteCarlo(
                orgId, model.get().getId(), monteCarlo.numSimulations(), monteCarlo.randomSeed());
        return ExecutionResult.builder()
                .operation(monteCarlo.operation())
                .params(monteCarlo)
                .referenceId(jobId)
                .message("Monte Carlo simulation queued (%d runs)".formatted(monteCarlo.numSimulations()))
                .build();
    }

    private ExecutionResult updateAssumptions(String orgId, String userId, ActionParams.AssumptionChange change) {
        Optional<FinancialModel> model = financialModelRepository.findLatestModel(orgId)
                .flatMap(m -> financialModelRepository.mergeAssumptions(m.getId(), change.changes()));
        if (model.isEmpty()) {
            return message(change, "No financial model available to update");
        }
        audit(orgId, userId, "assumption_updated", "model", model.get().getId(), new LinkedHashMap<>(change.changes()));
        groundingCache.invalidate(orgId);
        return ExecutionResult.builder()
                .operation(change.operation())
                .params(change)
                .referenceId(model.get().getId())
                .message("Assumptions updated")
                .build();
    }

    private ExecutionResult generateRecommendations(String orgId, String userId,
                                                    ActionParams.Recommendations recommendations, String modelRunId) {
        AiCfoPlan plan = planRepository.save(AiCfoPlan.builder()
                .orgId(orgId)
                .modelRunId(modelRunId)
                .createdById(userId)
                .name("Recommendations: " + recommendations.focus())
                .status(PlanStatus.DRAFT)
                .payload(PlanPayload.builder()
                        .goal(recommendations.focus())
                        .constraints(recommendations.constraints())
                        .intent(recommendations.focus())
                        .build())
                .build());
        return ExecutionResult.builder()
                .operation(recommendations.operation())
                .params(recommendations)
                .referenceId(plan.getId())
                .message("Recommendation plan drafted")
                .build();
    }

    private Optional<String> resolveModelId(String orgId, String modelRunId) {
        if (modelRunId != null) {
            Optional<String> fromRun = financialModelRepository.findRunById(modelRunId)
                    .filter(run -> orgId.equals(run.getOrgId()))
                    .map(ModelRun::getModelId);
            if (fromRun.isPresent()) {
                return fromRun;
            }
        }
        return financialModelRepository.findLatestModel(orgId).map(FinancialModel::getId);
    }

    private void audit(String orgId, String userId, String action, String objectType, String objectId,
                       Map<String, Object> meta) {
        auditLogRepository.append(AuditLogEntry.builder()
                .orgId(orgId)
                .actorUserId(userId)
                .action(action)
                .objectType(objectType)
                .objectId(objectId)
                .meta(meta)
                .build());
    }

    private static ExecutionResult message(ActionParams params, String message) {
        log.warn("{} skipped: {}", params.operation().getWireName(), message);
        return ExecutionResult.builder()
                .operation(params.operation())
                .params(params)
                .message(message)
                .build();
    }
}
