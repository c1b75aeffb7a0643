package com.cfoPilot.aiCfo.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Parameters of a planned action, one shape per {@link Operation}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "operation")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ActionParams.Runway.class, name = "calculate_runway"),
        @JsonSubTypes.Type(value = ActionParams.BurnRate.class, name = "calculate_burn_rate"),
        @JsonSubTypes.Type(value = ActionParams.RevenueForecast.class, name = "forecast_revenue"),
        @JsonSubTypes.Type(value = ActionParams.HireImpact.class, name = "calculate_hire_impact"),
        @JsonSubTypes.Type(value = ActionParams.Scenario.class, name = "create_scenario"),
        @JsonSubTypes.Type(value = ActionParams.MonteCarlo.class, name = "run_monte_carlo"),
        @JsonSubTypes.Type(value = ActionParams.AssumptionChange.class, name = "update_assumptions"),
        @JsonSubTypes.Type(value = ActionParams.Recommendations.class, name = "generate_recommendations")
})
public interface ActionParams {

    @JsonIgnore
    Operation operation();

    /** Numeric result for calculation operations. */
    default OptionalDouble numericResult() {
        return OptionalDouble.empty();
    }

    record Runway(double cash, double burn, double result, boolean burnDerived, boolean cashDerived)
            implements ActionParams {
        @Override
        public Operation operation() {
            return Operation.CALCULATE_RUNWAY;
        }

        @Override
        public OptionalDouble numericResult() {
            return OptionalDouble.of(result);
        }
    }

    /**
     * Burn derivation records only the inputs that were actually used.
     */
    record BurnRate(Double cash, Double runwayMonths, Double expenses, Double revenue, String method, double result)
            implements ActionParams {
        @Override
        public Operation operation() {
            return Operation.CALCULATE_BURN_RATE;
        }

        @Override
        public OptionalDouble numericResult() {
            return OptionalDouble.of(result);
        }
    }

    record RevenueForecast(double baseRevenue, double growthRate, int months, double result) implements ActionParams {
        @Override
        public Operation operation() {
            return Operation.FORECAST_REVENUE;
        }

        @Override
        public OptionalDouble numericResult() {
            return OptionalDouble.of(result);
        }
    }

    /** {@code result} is the added monthly cost. */
    record HireImpact(int hireCount, double annualSalary, double result) implements ActionParams {
        @Override
        public Operation operation() {
            return Operation.CALCULATE_HIRE_IMPACT;
        }

        @Override
        public OptionalDouble numericResult() {
            return OptionalDouble.of(result);
        }
    }

    record Scenario(String scenarioType, Double revenueGrowth, Double expenseChange, Double headcountChange)
            implements ActionParams {
        @Override
        public Operation operation() {
            return Operation.CREATE_SCENARIO;
        }
    }

    record MonteCarlo(int numSimulations, Long randomSeed) implements ActionParams {
        @Override
        public Operation operation() {
            return Operation.RUN_MONTE_CARLO;
        }
    }

    record AssumptionChange(Map<String, Double> changes) implements ActionParams {
        @Override
        public Operation operation() {
            return Operation.UPDATE_ASSUMPTIONS;
        }
    }

    record Recommendations(String focus, Map<String, Object> constraints) implements ActionParams {
        @Override
        public Operation operation() {
            return Operation.GENERATE_RECOMMENDATIONS;
        }
    }
}
