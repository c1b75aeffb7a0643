package com.cfoPilot.aiCfo.repository.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Headline figures produced by a completed model run. Monthly amounts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FinancialSummary {
    private Double cashBalance;
    private Double burnRate;
    private Double runwayMonths;
    private Double revenue;
    private Double expenses;
    private Double revenueGrowth;
    private String topExpense;
    private Double topExpenseValue;
}
