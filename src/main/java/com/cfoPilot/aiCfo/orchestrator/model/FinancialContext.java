package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

/**
 * Figures the fallback reasoner works from.
 */
@Value
@Builder
public class FinancialContext {
    double cashBalance;
    double burnRate;
    double runwayMonths;
    double revenue;
    /** Fraction, 0.08 = 8% month over month. */
    double revenueGrowth;
    String topExpense;
    double topExpenseValue;
    boolean hasRealData;

    /** Industry-typical SaaS profile used when the org has no data. */
    public static FinancialContext baseline() {
        return FinancialContext.builder()
                .cashBalance(500_000)
                .burnRate(80_000)
                .runwayMonths(6.25)
                .revenue(67_000)
                .revenueGrowth(0.08)
                .topExpense("Payroll")
                .topExpenseValue(45_000)
                .hasRealData(false)
                .build();
    }
}
