package com.cfoPilot.aiCfo.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Deterministic operations the planner can emit.
 * Calculations carry the category key their result is published under.
 */
public enum Operation {
    CALCULATE_RUNWAY("calculate_runway", ActionType.CALCULATION, "runway"),
    CALCULATE_BURN_RATE("calculate_burn_rate", ActionType.CALCULATION, "burnRate"),
    FORECAST_REVENUE("forecast_revenue", ActionType.CALCULATION, "futureRevenue"),
    CALCULATE_HIRE_IMPACT("calculate_hire_impact", ActionType.CALCULATION, "monthlyCost"),
    CREATE_SCENARIO("create_scenario", ActionType.SIMULATION, null),
    RUN_MONTE_CARLO("run_monte_carlo", ActionType.SIMULATION, null),
    UPDATE_ASSUMPTIONS("update_assumptions", ActionType.MODEL_UPDATE, null),
    GENERATE_RECOMMENDATIONS("generate_recommendations", ActionType.RECOMMENDATION, null);

    private final String wireName;
    private final ActionType actionType;
    private final String categoryKey;

    Operation(String wireName, ActionType actionType, String categoryKey) {
        this.wireName = wireName;
        this.actionType = actionType;
        this.categoryKey = categoryKey;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public ActionType getActionType() {
        return actionType;
    }

    /** Null for non-calculation operations. */
    public String getCategoryKey() {
        return categoryKey;
    }
}
