package com.cfoPilot.aiCfo.orchestrator.util;

import com.cfoPilot.aiCfo.orchestrator.model.ActionImpact;
import com.cfoPilot.aiCfo.repository.model.FinancialSummary;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic financial formulas. Invalid inputs yield an invalid result with errors, never NaN or Infinity.
 */
public final class FinancialCalculations {

    private FinancialCalculations() {}

    /**
     * Runway = Cash / Burn Rate.
     */
    public static CalculationResult runway(double cash, double burnRate) {
        String formula = "Runway = Cash / Burn Rate";
        if (cash < 0) {
            return CalculationResult.invalid(formula, "Cash balance cannot be negative");
        }
        if (burnRate == 0) {
            return CalculationResult.invalid(formula, "Burn rate is zero; runway is unbounded");
        }
        if (burnRate < 0) {
            return CalculationResult.invalid(formula, "Burn rate must be positive");
        }

        double runway = cash / burnRate;
        List<String> warnings = new ArrayList<>();
        if (runway < 1) {
            warnings.add("Runway is less than 1 month - critical cash situation");
        } else if (runway < 6) {
            warnings.add("Runway is below 6 months - start fundraising or cost planning now");
        }
        return CalculationResult.builder().valid(true).result(runway).formula(formula)
                .warnings(warnings).errors(List.of()).build();
    }

    /**
     * Burn Rate = Cash / Runway.
     */
    public static CalculationResult burnFromRunway(double cash, double runwayMonths) {
        String formula = "Burn Rate = Cash / Runway";
        if (cash < 0) {
            return CalculationResult.invalid(formula, "Cash balance cannot be negative");
        }
        if (runwayMonths <= 0) {
            return CalculationResult.invalid(formula, "Runway must be positive");
        }
        return CalculationResult.valid(formula, cash / runwayMonths);
    }

    /**
     * Burn Rate = Expenses - Revenue.
     */
    public static CalculationResult burnRate(double expenses, double revenue) {
        String formula = "Burn Rate = Expenses - Revenue";
        if (expenses < 0) {
            return CalculationResult.invalid(formula, "Expenses cannot be negative");
        }
        double burn = expenses - revenue;
        List<String> warnings = new ArrayList<>();
        if (burn < 0) {
            warnings.add("Negative burn rate - company is cash-flow positive");
        }
        return CalculationResult.builder().valid(true).result(burn).formula(formula)
                .warnings(warnings).errors(List.of()).build();
    }

    /**
     * Future Revenue = Base x (1 + g)^months.
     */
    public static CalculationResult futureRevenue(double baseRevenue, double growthRate, int months) {
        String formula = "Future Revenue = Base x (1 + g)^months";
        if (baseRevenue < 0) {
            return CalculationResult.invalid(formula, "Base revenue cannot be negative");
        }
        if (months < 0) {
            return CalculationResult.invalid(formula, "Months cannot be negative");
        }
        if (growthRate <= -1) {
            return CalculationResult.invalid(formula, "Growth rate must be greater than -100%");
        }
        return CalculationResult.valid(formula, baseRevenue * Math.pow(1 + growthRate, months));
    }

    /**
     * Monthly Cost = Hires x Annual Salary / 12.
     */
    public static CalculationResult hireMonthlyCost(int hireCount, double annualSalary) {
        String formula = "Monthly Cost = Hires x Annual Salary / 12";
        if (hireCount <= 0) {
            return CalculationResult.invalid(formula, "Hire count must be positive");
        }
        if (annualSalary <= 0) {
            return CalculationResult.invalid(formula, "Annual salary must be positive");
        }
        return CalculationResult.valid(formula, hireCount * annualSalary / 12.0);
    }

    /**
     * Impact of scaling burn by {@code (1 + expenseChange)} on the current state.
     *
     * A change that takes burn to zero or below is reported as an unbounded runway.
     *
     * @return null when the state lacks cash or burn
     */
    public static ActionImpact assumptionImpact(double expenseChange, FinancialSummary state) {
        if (state == null || !positive(state.getBurnRate()) || !positive(state.getCashBalance())) {
            return null;
        }
        double currentBurn = state.getBurnRate();
        double currentRunway = positive(state.getRunwayMonths())
                ? state.getRunwayMonths()
                : state.getCashBalance() / currentBurn;
        double newBurn = currentBurn * (1 + expenseChange);
        if (newBurn <= 0) {
            return ActionImpact.builder()
                    .burnDelta(newBurn - currentBurn)
                    .runwayUnbounded(true)
                    .build();
        }
        double newRunway = state.getCashBalance() / newBurn;
        double deltaMonths = newRunway - currentRunway;
        return ActionImpact.builder()
                .runwayDeltaMonths(deltaMonths)
                .runwayDeltaPercent(deltaMonths / currentRunway)
                .burnDelta(newBurn - currentBurn)
                .build();
    }

    /**
     * Impact of adding {@code monthlyCost} to the current burn.
     *
     * @return cost-only impact when the state lacks cash or burn
     */
    public static ActionImpact hireImpact(double monthlyCost, FinancialSummary state) {
        ActionImpact.ActionImpactBuilder impact = ActionImpact.builder()
                .costDelta(monthlyCost)
                .burnDelta(monthlyCost);
        if (state != null && positive(state.getBurnRate()) && positive(state.getCashBalance())) {
            double currentRunway = state.getCashBalance() / state.getBurnRate();
            double newRunway = state.getCashBalance() / (state.getBurnRate() + monthlyCost);
            impact.runwayDeltaMonths(newRunway - currentRunway)
                    .runwayDeltaPercent((newRunway - currentRunway) / currentRunway);
        }
        return impact.build();
    }

    private static boolean positive(Double value) {
        return value != null && value > 0;
    }

    @Value
    @Builder
    public static class CalculationResult {
        boolean valid;
        Double result;
        String formula;
        List<String> warnings;
        List<String> errors;

        static CalculationResult valid(String formula, double result) {
            return CalculationResult.builder().valid(true).result(result).formula(formula)
                    .warnings(List.of()).errors(List.of()).build();
        }

        static CalculationResult invalid(String formula, String error) {
            return CalculationResult.builder().valid(false).formula(formula)
                    .warnings(List.of()).errors(List.of(error)).build();
        }
    }
}
