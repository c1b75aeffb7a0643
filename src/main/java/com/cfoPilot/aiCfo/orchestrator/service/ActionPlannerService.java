package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.gateway.util.IdMasker;
import com.cfoPilot.aiCfo.orchestrator.model.ActionImpact;
import com.cfoPilot.aiCfo.orchestrator.model.ActionParams;
import com.cfoPilot.aiCfo.orchestrator.model.ActionType;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.Operation;
import com.cfoPilot.aiCfo.orchestrator.model.PlanValidation;
import com.cfoPilot.aiCfo.orchestrator.model.PlannerAction;
import com.cfoPilot.aiCfo.orchestrator.model.PlannerResult;
import com.cfoPilot.aiCfo.orchestrator.model.Slot;
import com.cfoPilot.aiCfo.orchestrator.model.SlotName;
import com.cfoPilot.aiCfo.orchestrator.util.FinancialCalculations;
import com.cfoPilot.aiCfo.orchestrator.util.FinancialCalculations.CalculationResult;
import com.cfoPilot.aiCfo.repository.FinancialModelRepository;
import com.cfoPilot.aiCfo.repository.model.FinancialSummary;
import com.cfoPilot.aiCfo.repository.model.ModelRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Action planner - maps an intent and its slots to deterministic operations.
 *
 * Planning reads model state but writes nothing. Missing inputs become validation issues;
 * only {@code update_assumptions} can be gated for approval.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActionPlannerService {

    public static final double APPROVAL_THRESHOLD = 0.15;
    static final int DEFAULT_SIMULATIONS = 5000;

    private final FinancialModelRepository financialModelRepository;

    /**
     * Plans the actions answering one classified query.
     *
     * @param orgId Organization
     * @param userId Acting user (does not affect the approval gate)
     * @param intent Classified intent
     * @param slots Extracted slots
     * @param modelRunId Run to read state from; latest completed run when null
     * @return actions plus validation; never throws for missing data
     */
    public PlannerResult plan(String orgId, String userId, IntentType intent, Map<SlotName, Slot> slots,
                              String modelRunId) {
        log.debug("Planning actions - orgId: {}, userId: {}, intent: {}",
                IdMasker.mask(orgId), IdMasker.mask(userId), intent.getWireName());

        FinancialSummary state = loadState(orgId, modelRunId);
        Planning planning = new Planning(slots == null ? Map.of() : slots, state);

        switch (intent) {
            case RUNWAY_CALCULATION, CASH_SURVIVAL_ESTIMATION -> planning.runway();
            case BURN_RATE_CALCULATION -> planning.burnRate();
            case REVENUE_FORECAST -> planning.revenueForecast();
            case HIRE_IMPACT -> planning.hireImpact();
            case SCENARIO_SIMULATION -> planning.scenario();
            case MONTE_CARLO -> planning.actions.add(
                    PlannerAction.of(new ActionParams.MonteCarlo(DEFAULT_SIMULATIONS, null)));
            case ASSUMPTION_EDIT -> planning.assumptionEdit();
            default -> {
                if (IntentType.ADVISORY.contains(intent)) {
                    planning.actions.add(PlannerAction.of(
                            new ActionParams.Recommendations(intent.getWireName(), Map.of())));
                } else {
                    planning.issues.add("Unsupported intent: " + intent.getWireName());
                }
            }
        }

        boolean requiresApproval = planning.actions.stream().anyMatch(PlannerAction::isRequiresApproval);
        PlanValidation validation = PlanValidation.builder()
                .ok(planning.issues.isEmpty())
                .issues(List.copyOf(planning.issues))
                .warnings(List.copyOf(planning.warnings))
                .build();

        log.info("Planned {} action(s) - intent: {}, ok: {}, requiresApproval: {}",
                planning.actions.size(), intent.getWireName(), validation.isOk(), requiresApproval);

        return PlannerResult.builder()
                .actions(List.copyOf(planning.actions))
                .validation(validation)
                .requiresApproval(requiresApproval)
                .approvalThreshold(requiresApproval ? APPROVAL_THRESHOLD : null)
                .build();
    }

    private FinancialSummary loadState(String orgId, String modelRunId) {
        Optional<ModelRun> run = modelRunId != null
                ? financialModelRepository.findRunById(modelRunId).filter(r -> orgId.equals(r.getOrgId()))
                : Optional.empty();
        if (run.isEmpty()) {
            run = financialModelRepository.findLatestCompletedRun(orgId);
        }
        return run.map(ModelRun::getSummary).orElse(null);
    }

    /**
     * Accumulates actions, issues and warnings for one plan call.
     */
    private static final class Planning {

        private final Map<SlotName, Slot> slots;
        private final FinancialSummary state;
        private final List<PlannerAction> actions = new ArrayList<>();
        private final List<String> issues = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private Planning(Map<SlotName, Slot> slots, FinancialSummary state) {
            this.slots = slots;
            this.state = state;
        }

        void runway() {
            Double cash = slot(SlotName.CASH);
            Double burn = slot(SlotName.BURN_RATE);
            Double runway = slot(SlotName.RUNWAY_MONTHS);
            boolean burnDerived = false;
            boolean cashDerived = false;

            if (cash != null && burn == null && runway != null && runway > 0) {
                burn = cash / runway;
                burnDerived = true;
            } else if (burn != null && cash == null && runway != null) {
                cash = burn * runway;
                cashDerived = true;
            }
            if (cash == null && state != null) {
                cash = state.getCashBalance();
            }
            if (burn == null && state != null) {
                burn = state.getBurnRate();
            }

            if (cash == null || burn == null) {
                List<String> missing = new ArrayList<>();
                if (cash == null) {
                    missing.add("cash");
                }
                if (burn == null) {
                    missing.add("burn_rate");
                }
                issues.add("Missing required slots: " + String.join(" and ", missing));
                return;
            }

            CalculationResult result = FinancialCalculations.runway(cash, burn);
            if (accept(result)) {
                actions.add(PlannerAction.of(
                        new ActionParams.Runway(cash, burn, result.getResult(), burnDerived, cashDerived)));
            }
        }

        void burnRate() {
            Double cash = slot(SlotName.CASH);
            Double runway = slot(SlotName.RUNWAY_MONTHS);
            Double burn = slot(SlotName.BURN_RATE);
            Double expenses = slot(SlotName.EXPENSES);

            if (cash != null && runway != null) {
                CalculationResult result = FinancialCalculations.burnFromRunway(cash, runway);
                if (accept(result)) {
                    actions.add(PlannerAction.of(new ActionParams.BurnRate(
                            cash, runway, null, null, "cash_over_runway", result.getResult())));
                }
                return;
            }
            if (burn != null) {
                actions.add(PlannerAction.of(new ActionParams.BurnRate(
                        null, null, null, null, "stated", burn)));
                return;
            }
            if (expenses != null) {
                Double revenue = slot(SlotName.BASE_REVENUE);
                if (revenue == null) {
                    revenue = state != null && state.getRevenue() != null ? state.getRevenue() : 0.0;
                }
                CalculationResult result = FinancialCalculations.burnRate(expenses, revenue);
                if (accept(result)) {
                    actions.add(PlannerAction.of(new ActionParams.BurnRate(
                            null, null, expenses, revenue, "expenses_minus_revenue", result.getResult())));
                }
                return;
            }
            if (state != null && state.getBurnRate() != null) {
                actions.add(PlannerAction.of(new ActionParams.BurnRate(
                        null, null, null, null, "model_state", state.getBurnRate())));
                return;
            }
            issues.add("Missing required slots: burn_rate or expenses");
        }

        void revenueForecast() {
            Double base = slot(SlotName.BASE_REVENUE);
            if (base == null && state != null) {
                base = state.getRevenue();
            }
            Double growth = slot(SlotName.REVENUE_GROWTH);
            if (growth == null && state != null) {
                growth = state.getRevenueGrowth();
            }
            Double months = slot(SlotName.MONTHS);

            List<String> missing = new ArrayList<>();
            if (base == null) {
                missing.add("base_revenue");
            }
            if (growth == null) {
                missing.add("revenue_growth");
            }
            if (months == null) {
                missing.add("months");
            }
            if (!missing.isEmpty()) {
                issues.add("Missing required slots: " + String.join(", ", missing));
                return;
            }

            int horizon = (int) Math.round(months);
            CalculationResult result = FinancialCalculations.futureRevenue(base, growth, horizon);
            if (accept(result)) {
                actions.add(PlannerAction.of(
                        new ActionParams.RevenueForecast(base, growth, horizon, result.getResult())));
            }
        }

        void hireImpact() {
            Double count = slot(SlotName.HIRE_COUNT);
            Double salary = slot(SlotName.ANNUAL_SALARY);
            if (count == null || salary == null) {
                List<String> missing = new ArrayList<>();
                if (count == null) {
                    missing.add("hire_count");
                }
                if (salary == null) {
                    missing.add("annual_salary");
                }
                issues.add("Missing required slots: " + String.join(", ", missing));
                return;
            }

            int hires = (int) Math.round(count);
            CalculationResult result = FinancialCalculations.hireMonthlyCost(hires, salary);
            if (!accept(result)) {
                return;
            }
            ActionImpact impact = FinancialCalculations.hireImpact(result.getResult(), state);
            actions.add(PlannerAction.builder()
                    .type(ActionType.CALCULATION)
                    .operation(Operation.CALCULATE_HIRE_IMPACT)
                    .params(new ActionParams.HireImpact(hires, salary, result.getResult()))
                    .impact(impact)
                    .build());
        }

        void scenario() {
            Double headcount = slot(SlotName.HIRE_COUNT);
            actions.add(PlannerAction.of(new ActionParams.Scenario(
                    "base",
                    slot(SlotName.REVENUE_GROWTH),
                    slot(SlotName.EXPENSE_CHANGE),
                    headcount)));
        }

        void assumptionEdit() {
            Double expenseChange = slot(SlotName.EXPENSE_CHANGE);
            if (expenseChange == null) {
                issues.add("Missing required slots: expense_change");
                return;
            }

            ActionParams params = new ActionParams.AssumptionChange(Map.of("expenseChange", expenseChange));
            ActionImpact impact = FinancialCalculations.assumptionImpact(expenseChange, state);
            if (impact == null) {
                warnings.add(state == null
                        ? "Runway impact unavailable: no model state"
                        : "Runway impact unavailable: model state lacks cash or burn");
                actions.add(PlannerAction.of(params));
                return;
            }

            boolean gated = impact.isRunwayUnbounded()
                    || Math.abs(impact.getRunwayDeltaPercent()) > APPROVAL_THRESHOLD;
            if (impact.isRunwayUnbounded()) {
                warnings.add("Large impact detected: burn falls to zero, runway becomes unbounded");
            } else if (gated) {
                warnings.add("Large impact detected: %.1f%% runway change"
                        .formatted(impact.getRunwayDeltaPercent() * 100));
            }
            actions.add(PlannerAction.builder()
                    .type(params.operation().getActionType())
                    .operation(params.operation())
                    .params(params)
                    .requiresApproval(gated)
                    .approvalReason(gated ? "Large impact on runway" : null)
                    .impact(impact)
                    .build());
        }

        private boolean accept(CalculationResult result) {
            warnings.addAll(result.getWarnings());
            if (!result.isValid()) {
                issues.addAll(result.getErrors());
                return false;
            }
            return true;
        }

        private Double slot(SlotName name) {
            Slot slot = slots.get(name);
            return slot == null ? null : slot.getNormalizedValue();
        }
    }
}
