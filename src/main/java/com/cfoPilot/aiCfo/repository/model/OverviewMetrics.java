package com.cfoPilot.aiCfo.repository.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dashboard overview for one org.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OverviewMetrics {
    private String orgId;
    private Double monthlyRevenue;
    private Double monthlyBurnRate;
    private Double cashRunway;
    /** Fraction, not percent. */
    private Double revenueGrowth;
    private Double healthScore;
    private Integer activeCustomers;
    private String topExpense;
    private Double topExpenseValue;

    public boolean hasActivity() {
        return (monthlyRevenue != null && monthlyRevenue > 0) || (monthlyBurnRate != null && monthlyBurnRate > 0);
    }
}
