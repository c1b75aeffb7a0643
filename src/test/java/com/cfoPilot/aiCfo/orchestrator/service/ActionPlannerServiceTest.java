package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.orchestrator.model.ActionParams;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.Operation;
import com.cfoPilot.aiCfo.orchestrator.model.PlannerAction;
import com.cfoPilot.aiCfo.orchestrator.model.PlannerResult;
import com.cfoPilot.aiCfo.orchestrator.model.Slot;
import com.cfoPilot.aiCfo.orchestrator.model.SlotName;
import com.cfoPilot.aiCfo.repository.FinancialModelRepository;
import com.cfoPilot.aiCfo.repository.model.FinancialSummary;
import com.cfoPilot.aiCfo.repository.model.ModelRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ActionPlannerServiceTest {

    private static final String ORG_ID = "3f2a9c1e-8b4d-4f6a-a1c2-9e7d5b3a1c90";
    private static final String USER_ID = "9b8a7c6d-5e4f-4a3b-9c2d-1e0f9a8b7c61";

    private FinancialModelRepository financialModelRepository;
    private ActionPlannerService planner;

    @BeforeEach
    void setUp() {
        financialModelRepository = mock(FinancialModelRepository.class);
        planner = new ActionPlannerService(financialModelRepository);
    }

    @Test
    void runwayFromStatedCashAndBurn() {
        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.RUNWAY_CALCULATION,
                slots(SlotName.CASH, 600_000, SlotName.BURN_RATE, 50_000), null);

        assertThat(result.getValidation().isOk()).isTrue();
        assertThat(result.getActions()).singleElement().satisfies(action -> {
            assertThat(action.getOperation()).isEqualTo(Operation.CALCULATE_RUNWAY);
            assertThat(action.getParams().numericResult().getAsDouble()).isEqualTo(12.0);
        });
        assertThat(result.isRequiresApproval()).isFalse();
        assertThat(result.getApprovalThreshold()).isNull();
    }

    @Test
    void runwayDerivesBurnFromCashAndRunwayMonths() {
        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.RUNWAY_CALCULATION,
                slots(SlotName.CASH, 600_000, SlotName.RUNWAY_MONTHS, 10), null);

        ActionParams.Runway params = (ActionParams.Runway) result.getActions().get(0).getParams();
        assertThat(params.burn()).isEqualTo(60_000);
        assertThat(params.burnDerived()).isTrue();
    }

    @Test
    void runwayFallsBackToModelState() {
        stubLatestState();

        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.RUNWAY_CALCULATION, Map.of(), null);

        assertThat(result.getActions().get(0).getParams().numericResult().getAsDouble()).isEqualTo(15.0);
    }

    @Test
    void runwayWithoutAnyDataReportsMissingSlots() {
        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.RUNWAY_CALCULATION, Map.of(), null);

        assertThat(result.getActions()).isEmpty();
        assertThat(result.getValidation().isOk()).isFalse();
        assertThat(result.getValidation().getIssues()).containsExactly("Missing required slots: cash and burn_rate");
    }

    @Test
    void zeroBurnIsAnIssueNotAnInfiniteRunway() {
        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.RUNWAY_CALCULATION,
                slots(SlotName.CASH, 600_000, SlotName.BURN_RATE, 0), null);

        assertThat(result.getActions()).isEmpty();
        assertThat(result.getValidation().getIssues()).isNotEmpty();
    }

    @Test
    void burnRateMethodsFollowAvailableInputs() {
        assertThat(burnParams(slots(SlotName.CASH, 600_000, SlotName.RUNWAY_MONTHS, 12)).method())
                .isEqualTo("cash_over_runway");
        assertThat(burnParams(slots(SlotName.BURN_RATE, 45_000)).method()).isEqualTo("stated");
        ActionParams.BurnRate fromExpenses = burnParams(slots(SlotName.EXPENSES, 200_000, SlotName.BASE_REVENUE, 80_000));
        assertThat(fromExpenses.method()).isEqualTo("expenses_minus_revenue");
        assertThat(fromExpenses.result()).isEqualTo(120_000);
    }

    @Test
    void revenueForecastListsEveryMissingInput() {
        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.REVENUE_FORECAST, Map.of(), null);

        assertThat(result.getValidation().getIssues())
                .containsExactly("Missing required slots: base_revenue, revenue_growth, months");
    }

    @Test
    void revenueForecastCompoundsGrowth() {
        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.REVENUE_FORECAST,
                slots(SlotName.BASE_REVENUE, 100_000, SlotName.REVENUE_GROWTH, 0.10, SlotName.MONTHS, 2), null);

        assertThat(result.getActions().get(0).getParams().numericResult().getAsDouble()).isCloseTo(121_000, within(1e-6));
    }

    @Test
    void hireImpactCarriesRunwayDeltaWhenStateExists() {
        stubLatestState();

        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.HIRE_IMPACT,
                slots(SlotName.HIRE_COUNT, 2, SlotName.ANNUAL_SALARY, 120_000), null);

        PlannerAction action = result.getActions().get(0);
        assertThat(action.getParams().numericResult().getAsDouble()).isEqualTo(20_000);
        assertThat(action.getImpact().getRunwayDeltaMonths()).isNegative();
    }

    @Test
    void largeExpenseIncreaseRequiresApproval() {
        stubLatestState();

        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.ASSUMPTION_EDIT,
                slots(SlotName.EXPENSE_CHANGE, 0.25), null);

        assertThat(result.isRequiresApproval()).isTrue();
        assertThat(result.getApprovalThreshold()).isEqualTo(0.15);
        PlannerAction action = result.getActions().get(0);
        assertThat(action.getOperation()).isEqualTo(Operation.UPDATE_ASSUMPTIONS);
        assertThat(action.getApprovalReason()).isEqualTo("Large impact on runway");
        assertThat(result.getValidation().getWarnings()).anyMatch(w -> w.startsWith("Large impact detected"));
    }

    @Test
    void smallExpenseChangeIsNotGated() {
        stubLatestState();

        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.ASSUMPTION_EDIT,
                slots(SlotName.EXPENSE_CHANGE, -0.05), null);

        assertThat(result.isRequiresApproval()).isFalse();
    }

    @Test
    void cuttingAllExpensesRequiresApproval() {
        stubLatestState();

        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.ASSUMPTION_EDIT,
                slots(SlotName.EXPENSE_CHANGE, -1.0), null);

        assertThat(result.isRequiresApproval()).isTrue();
        PlannerAction action = result.getActions().get(0);
        assertThat(action.isRequiresApproval()).isTrue();
        assertThat(action.getImpact().isRunwayUnbounded()).isTrue();
        assertThat(action.getImpact().getBurnDelta()).isEqualTo(-120_000);
        assertThat(result.getValidation().getWarnings())
                .contains("Large impact detected: burn falls to zero, runway becomes unbounded")
                .doesNotContain("Runway impact unavailable: no model state");
    }

    @Test
    void cuttingMoreThanAllExpensesRequiresApproval() {
        stubLatestState();

        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.ASSUMPTION_EDIT,
                slots(SlotName.EXPENSE_CHANGE, -1.5), null);

        assertThat(result.isRequiresApproval()).isTrue();
        assertThat(result.getActions()).singleElement()
                .satisfies(action -> assertThat(action.getImpact().isRunwayUnbounded()).isTrue());
    }

    @Test
    void stateWithoutBurnIsNotReportedAsMissing() {
        when(financialModelRepository.findLatestCompletedRun(ORG_ID)).thenReturn(Optional.of(ModelRun.builder()
                .id("run-2").orgId(ORG_ID)
                .summary(FinancialSummary.builder().cashBalance(500_000d).build())
                .build()));

        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.ASSUMPTION_EDIT,
                slots(SlotName.EXPENSE_CHANGE, -0.3), null);

        assertThat(result.getValidation().getWarnings())
                .contains("Runway impact unavailable: model state lacks cash or burn");
    }

    @Test
    void assumptionEditWithoutStateWarnsButStillPlans() {
        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.ASSUMPTION_EDIT,
                slots(SlotName.EXPENSE_CHANGE, 0.5), null);

        assertThat(result.isRequiresApproval()).isFalse();
        assertThat(result.getActions()).hasSize(1);
        assertThat(result.getValidation().getWarnings()).contains("Runway impact unavailable: no model state");
    }

    @Test
    void advisoryIntentPlansRecommendations() {
        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.FUNDRAISING_READINESS, Map.of(), null);

        assertThat(result.getActions()).singleElement()
                .extracting(PlannerAction::getOperation).isEqualTo(Operation.GENERATE_RECOMMENDATIONS);
    }

    @Test
    void unsupportedIntentIsReported() {
        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.GENERATE_BOARD_DECK, Map.of(), null);

        assertThat(result.getActions()).isEmpty();
        assertThat(result.getValidation().getIssues()).containsExactly("Unsupported intent: generate_board_deck");
    }

    @Test
    void runFromAnotherOrgIsIgnored() {
        when(financialModelRepository.findRunById("run-other")).thenReturn(Optional.of(ModelRun.builder()
                .id("run-other").orgId("another-org")
                .summary(FinancialSummary.builder().cashBalance(10d).burnRate(1d).build())
                .build()));

        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.RUNWAY_CALCULATION, Map.of(), "run-other");

        assertThat(result.getActions()).isEmpty();
    }

    private ActionParams.BurnRate burnParams(Map<SlotName, Slot> slots) {
        PlannerResult result = planner.plan(ORG_ID, USER_ID, IntentType.BURN_RATE_CALCULATION, slots, null);
        return (ActionParams.BurnRate) result.getActions().get(0).getParams();
    }

    private void stubLatestState() {
        when(financialModelRepository.findLatestCompletedRun(ORG_ID)).thenReturn(Optional.of(ModelRun.builder()
                .id("run-1").orgId(ORG_ID)
                .summary(FinancialSummary.builder()
                        .cashBalance(1_800_000d).burnRate(120_000d).runwayMonths(15d).revenue(95_000d).build())
                .build()));
    }

    private static Map<SlotName, Slot> slots(Object... pairs) {
        Map<SlotName, Slot> slots = new EnumMap<>(SlotName.class);
        for (int i = 0; i < pairs.length; i += 2) {
            double value = ((Number) pairs[i + 1]).doubleValue();
            slots.put((SlotName) pairs[i], Slot.builder()
                    .rawValue(String.valueOf(value))
                    .normalizedValue(value)
                    .confidence(0.9)
                    .build());
        }
        return slots;
    }
}
