package com.cfoPilot.aiCfo.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Closed taxonomy of financial intents. Wire names are what the LLM returns and what is persisted.
 */
public enum IntentType {
    RUNWAY_CALCULATION("runway_calculation"),
    BURN_RATE_CALCULATION("burn_rate_calculation"),
    REVENUE_FORECAST("revenue_forecast"),
    EXPENSE_FORECAST("expense_forecast"),
    HIRE_IMPACT("hire_impact"),
    CHURN_IMPACT("churn_impact"),
    CAC_LTV_ANALYSIS("cac_ltv_analysis"),
    SCENARIO_SIMULATION("scenario_simulation"),
    MONTE_CARLO("monte_carlo"),
    BUDGET_VS_ACTUAL("budget_vs_actual"),
    VARIANCE_ANALYSIS("variance_analysis"),
    ANOMALY_DETECTION("anomaly_detection"),
    RISK_ANALYSIS("risk_analysis"),
    STRATEGY_RECOMMENDATION("strategy_recommendation"),
    ASSUMPTION_EDIT("assumption_edit"),
    DATA_IMPORT("data_import"),
    MODEL_SYNC("model_sync"),
    GENERATE_BOARD_DECK("generate_board_deck"),
    EXPORT_REPORT("export_report"),
    FUNDRAISING_READINESS("fundraising_readiness"),
    CASH_SURVIVAL_ESTIMATION("cash_survival_estimation"),
    HEADCOUNT_PLANNING("headcount_planning"),
    UNIT_ECONOMICS_ANALYSIS("unit_economics_analysis"),
    COST_OPTIMIZATION("cost_optimization"),
    PRICING_IMPACT("pricing_impact"),
    MARGIN_IMPROVEMENT("margin_improvement");

    /** Intents the structured response schema accepts. */
    public static final Set<IntentType> RESPONSE_SUPPORTED = EnumSet.of(
            RUNWAY_CALCULATION, BURN_RATE_CALCULATION, REVENUE_FORECAST,
            SCENARIO_SIMULATION, MONTE_CARLO, STRATEGY_RECOMMENDATION);

    /** Advisory intents answered with generated recommendations rather than a calculation. */
    public static final Set<IntentType> ADVISORY = EnumSet.of(
            STRATEGY_RECOMMENDATION, FUNDRAISING_READINESS, COST_OPTIMIZATION, MARGIN_IMPROVEMENT,
            UNIT_ECONOMICS_ANALYSIS, CAC_LTV_ANALYSIS, PRICING_IMPACT, RISK_ANALYSIS, HEADCOUNT_PLANNING);

    private final String wireName;

    IntentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<IntentType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(type -> type.wireName.equals(normalized))
                .findFirst();
    }

    public boolean isRunwayRelated() {
        return this == RUNWAY_CALCULATION || this == CASH_SURVIVAL_ESTIMATION;
    }
}
