package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.orchestrator.model.FinancialContext;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.Recommendation;
import com.cfoPilot.aiCfo.orchestrator.util.RecommendationDeduplicator;
import com.cfoPilot.aiCfo.repository.model.FinancialSummary;
import com.cfoPilot.aiCfo.repository.model.OverviewMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic fallback reasoner ("CFO brain").
 *
 * Produces recommendations and an explanation from the org's numbers with no external AI call.
 * Every figure in the output comes from the context or the calculations passed in.
 */
@Slf4j
@Service
public class CfoBrainService {

    static final int MIN_RECOMMENDATIONS = 3;
    static final double OVERVIEW_CASH_FALLBACK = 100_000;

    private static final String REVENUE_STRATEGIES = """

            **1. Customer Acquisition Optimization**
            - Analyze your current CAC and optimize channels with the best LTV:CAC ratio
            - Implement referral programs to leverage existing customers
            - Focus on high-intent channels that align with your ideal customer profile

            **2. Pricing & Packaging Strategy**
            - Review your pricing model and test value-based pricing tiers
            - Consider expansion revenue through upsells and add-ons
            - Implement annual contracts with discounts to improve cash flow

            **3. Sales Process Enhancement**
            - Shorten sales cycles by removing friction points
            - Implement sales automation for lead nurturing
            - Focus on high-value deals that move the needle

            **4. Customer Retention & Expansion**
            - Reduce churn through proactive customer success
            - Implement expansion revenue strategies (upsells, cross-sells)
            - Build strong customer relationships that drive advocacy

            **5. Market Expansion**
            - Identify new market segments or geographies
            - Develop partnerships and channel strategies
            - Consider product extensions that serve adjacent markets""";

    /**
     * Picks the figures to reason from: the run summary, then the overview, then the baseline.
     */
    public FinancialContext resolveContext(FinancialSummary runSummary, OverviewMetrics overview) {
        if (runSummary != null) {
            double cash = orZero(runSummary.getCashBalance());
            double burn = orZero(runSummary.getBurnRate());
            double runway = runSummary.getRunwayMonths() != null
                    ? runSummary.getRunwayMonths()
                    : (burn > 0 ? cash / burn : 0);
            return FinancialContext.builder()
                    .cashBalance(cash)
                    .burnRate(burn)
                    .runwayMonths(runway)
                    .revenue(orZero(runSummary.getRevenue()))
                    .revenueGrowth(orZero(runSummary.getRevenueGrowth()))
                    .topExpense(runSummary.getTopExpense() != null ? runSummary.getTopExpense() : "OpEx")
                    .topExpenseValue(orZero(runSummary.getTopExpenseValue()))
                    .hasRealData(true)
                    .build();
        }
        if (overview != null && overview.hasActivity()) {
            double burn = orZero(overview.getMonthlyBurnRate());
            double runway = orZero(overview.getCashRunway());
            double cash = runway * burn;
            return FinancialContext.builder()
                    .cashBalance(cash > 0 ? cash : OVERVIEW_CASH_FALLBACK)
                    .burnRate(burn)
                    .runwayMonths(runway)
                    .revenue(orZero(overview.getMonthlyRevenue()))
                    .revenueGrowth(orZero(overview.getRevenueGrowth()))
                    .topExpense(overview.getTopExpense() != null ? overview.getTopExpense() : "OpEx")
                    .topExpenseValue(orZero(overview.getTopExpenseValue()))
                    .hasRealData(true)
                    .build();
        }
        return FinancialContext.baseline();
    }

    /**
     * One primary recommendation chosen by intent (the goal text is a secondary cue),
     * topped up to {@value #MIN_RECOMMENDATIONS} and deduplicated.
     */
    public List<Recommendation> generate(String goal, Map<String, Object> constraints, FinancialContext context,
                                         IntentType intent) {
        String lowerGoal = goal == null ? "" : goal.toLowerCase(Locale.ROOT);
        List<String> evidence = baseEvidence(context);
        List<Recommendation.DataSource> dataSources = dataSources(evidence);
        List<Recommendation> recommendations = new ArrayList<>();

        if (intent == IntentType.RUNWAY_CALCULATION || intent == IntentType.CASH_SURVIVAL_ESTIMATION
                || lowerGoal.contains("runway") || lowerGoal.contains("how long")) {
            recommendations.add(runwayRecommendation(context, targetRunway(constraints), evidence, dataSources));
        } else if (intent == IntentType.BURN_RATE_CALCULATION || lowerGoal.contains("burn")) {
            String expense = context.getTopExpense() != null ? context.getTopExpense() : "major expenses";
            String summary = "Analyzing %s which accounts for %s of spend."
                    .formatted(expense, money(context.getTopExpenseValue()));
            recommendations.add(Recommendation.builder()
                    .type("burn_efficiency")
                    .category("efficiency")
                    .title("Optimize monthly burn of " + money(context.getBurnRate()))
                    .action("Optimize monthly burn of " + money(context.getBurnRate()))
                    .summary(summary)
                    .reasoning(summary)
                    .explain("Incremental efficiency in %s can significantly extend runway.".formatted(expense))
                    .impact(Map.of("burnReduction", "5-10%", "capitalEfficiency", "+15%"))
                    .priority("medium")
                    .confidence(0.9)
                    .evidence(evidence)
                    .dataSources(dataSources)
                    .build());
        } else if (intent == IntentType.FUNDRAISING_READINESS || lowerGoal.contains("raise")
                || lowerGoal.contains("funding")) {
            String growth = "Growth: %s MoM".formatted(percent(context.getRevenueGrowth()));
            String summary = context.getRunwayMonths() >= 12
                    ? "With %s runway, you are in a position of strength to raise.".formatted(months(context))
                    : "With %s runway, start the raise now to avoid negotiating from a deadline.".formatted(months(context));
            recommendations.add(Recommendation.builder()
                    .type("fundraising_strategy")
                    .category("capital")
                    .title("Strategic Fundraising Readiness Audit")
                    .action("Strategic Fundraising Readiness Audit")
                    .summary(summary)
                    .reasoning(summary)
                    .explain("Capital markets reward companies with 18+ months runway and predictable growth.")
                    .impact(Map.of("valuationPremium", "Targeted", "dilutionControl", "High"))
                    .priority("high")
                    .confidence(0.85)
                    .evidence(append(evidence, growth))
                    .dataSources(append(dataSources, new Recommendation.DataSource("growth_metric", "growth_rate", growth)))
                    .build());
        } else if (intent == IntentType.REVENUE_FORECAST || lowerGoal.contains("revenue") || lowerGoal.contains("growth")) {
            String mrr = "MRR: " + money(context.getRevenue());
            String summary = "Current revenue is %s with %s growth."
                    .formatted(money(context.getRevenue()), percent(context.getRevenueGrowth()));
            recommendations.add(Recommendation.builder()
                    .type("growth_acceleration")
                    .category("revenue")
                    .title("Accelerate high-margin subscription growth")
                    .action("Accelerate high-margin subscription growth")
                    .summary(summary)
                    .reasoning(summary)
                    .explain("Focusing on Net Revenue Retention (NRR) will maximize the LTV of your existing base.")
                    .impact(Map.of("arrGrowth", "+12%", "ltvExpansion", "Significant"))
                    .priority("high")
                    .confidence(0.95)
                    .evidence(append(evidence, mrr))
                    .dataSources(append(dataSources, new Recommendation.DataSource("revenue_metric", "mrr", mrr)))
                    .build());
        } else if (intent == IntentType.COST_OPTIMIZATION || lowerGoal.contains("cost") || lowerGoal.contains("save")
                || lowerGoal.contains("reduce")) {
            String expense = context.getTopExpense() != null ? context.getTopExpense() : "Major expense";
            String summary = "%s is %s. Benchmarking against industry peers."
                    .formatted(expense, money(context.getTopExpenseValue()));
            recommendations.add(Recommendation.builder()
                    .type("cost_structure_optimization")
                    .category("opEx")
                    .title("Review %s cost structure".formatted(expense))
                    .action("Review %s cost structure".formatted(expense))
                    .summary(summary)
                    .reasoning(summary)
                    .explain("Targeting a 7% reduction in non-core operational expenses.")
                    .impact(Map.of("monthlySavings", money(context.getBurnRate() * 0.07),
                            "runwayExtension", "+2 months"))
                    .priority("medium")
                    .confidence(0.9)
                    .evidence(evidence)
                    .dataSources(dataSources)
                    .build());
        } else if (intent == IntentType.UNIT_ECONOMICS_ANALYSIS || lowerGoal.contains("metric")
                || lowerGoal.contains("kpi")) {
            String summary = "Revenue per customer and acquisition cost analysis based on %s MRR."
                    .formatted(money(context.getRevenue()));
            recommendations.add(Recommendation.builder()
                    .type("metric_benchmarking")
                    .category("metrics")
                    .title("Benchmark SaaS Unit Economics")
                    .action("Benchmark SaaS Unit Economics")
                    .summary(summary)
                    .reasoning(summary)
                    .explain("Ensuring LTV:CAC ratio remains above 3x for sustainable scaling.")
                    .impact(Map.of("paybackPeriod", "< 12 months", "unitProfitability", "Positive"))
                    .priority("medium")
                    .confidence(0.8)
                    .evidence(evidence)
                    .dataSources(dataSources)
                    .build());
        } else {
            String summary = "Overall assessment of cash (%s) and growth (%s)."
                    .formatted(money(context.getCashBalance()), percent(context.getRevenueGrowth()));
            recommendations.add(Recommendation.builder()
                    .type("strategic_review")
                    .category("strategy")
                    .title("Comprehensive Strategic Financial Health Check")
                    .action("Comprehensive Strategic Financial Health Check")
                    .summary(summary)
                    .reasoning(summary)
                    .explain("A holistic review ensures all financial levers are aligned with the company's long-term vision.")
                    .impact(Map.of("strategicClarity", "High", "executionAlignment", "Verified"))
                    .priority("medium")
                    .confidence(0.8)
                    .evidence(evidence)
                    .dataSources(dataSources)
                    .build());
        }

        topUp(recommendations, context, evidence, dataSources);
        List<Recommendation> unique = RecommendationDeduplicator.deduplicate(recommendations);
        log.debug("Fallback reasoner produced {} recommendation(s) - intent: {}, realData: {}",
                unique.size(), intent == null ? "none" : intent.getWireName(), context.isHasRealData());
        return unique;
    }

    /**
     * Natural-language answer built from templates over the same numbers.
     */
    public String explain(String goal, IntentType intent, List<Recommendation> recommendations,
                          FinancialContext context, Map<String, Double> calculations) {
        String lowerGoal = goal == null ? "" : goal.toLowerCase(Locale.ROOT);
        if (recommendations == null || recommendations.isEmpty()) {
            return "I've analyzed your query: \"%s\". Based on your financial data, I recommend focusing on "
                    .formatted(goal) + "optimizing your cash position and growth trajectory.";
        }

        Recommendation primary = recommendations.get(0);
        String primaryText = primary.getExplain() != null ? primary.getExplain() : primary.getSummary();
        double runway = figure(calculations, "runway", context.getRunwayMonths());
        double burn = figure(calculations, "burnRate", context.getBurnRate());
        double revenue = figure(calculations, "revenue", context.getRevenue());
        double growth = figure(calculations, "growth", context.getRevenueGrowth());

        if (intent == IntentType.RUNWAY_CALCULATION || intent == IntentType.CASH_SURVIVAL_ESTIMATION
                || lowerGoal.contains("runway")) {
            return "Based on your current financial position, your cash runway is approximately %s months. %s"
                    .formatted("%.1f".formatted(runway), primaryText);
        }
        if (intent == IntentType.BURN_RATE_CALCULATION || lowerGoal.contains("burn")) {
            return "Your monthly burn rate is currently %s. %s".formatted(money(burn), primaryText);
        }
        if (lowerGoal.contains("revenue")
                && (lowerGoal.contains("strateg") || lowerGoal.contains("accelerate"))) {
            return "Based on your current monthly revenue of %s and growth rate of %s, here are specific strategies to accelerate revenue growth:\n"
                    .formatted(money(revenue), percent(growth)) + REVENUE_STRATEGIES;
        }
        if (lowerGoal.contains("revenue")) {
            return "Your current monthly revenue is %s with a growth rate of %s. %s"
                    .formatted(money(revenue), percent(growth), primaryText);
        }
        if (lowerGoal.contains("funding") || lowerGoal.contains("raise")) {
            return "Based on your %.1f-month runway and %s revenue growth, %s"
                    .formatted(runway, percent(growth),
                            primary.getSummary() != null ? primary.getSummary() : primary.getExplain());
        }

        StringBuilder text = new StringBuilder()
                .append(primary.getSummary()).append(' ').append(primary.getExplain());
        if (recommendations.size() > 1) {
            text.append(" Additionally, ").append(recommendations.get(1).getSummary());
        }
        return text.toString();
    }

    private Recommendation runwayRecommendation(FinancialContext context, Double targetRunway, List<String> evidence,
                                                List<Recommendation.DataSource> dataSources) {
        String runway = months(context);
        String title;
        String summary;
        String explain;
        String priority;
        Map<String, String> impact;
        if (targetRunway != null && targetRunway > context.getRunwayMonths()) {
            title = "Extend runway from %s to %.0f months".formatted(runway, targetRunway);
            summary = "Your runway is %s against a target of %.0f months.".formatted(runway, targetRunway);
            explain = "Closing the gap needs %s/mo less burn or %s of new capital.".formatted(
                    money(Math.max(0, context.getBurnRate() - context.getCashBalance() / targetRunway)),
                    money((targetRunway - context.getRunwayMonths()) * context.getBurnRate()));
            priority = "high";
            impact = Map.of("runwayTarget", "%.0f months".formatted(targetRunway), "bufferSafety", "Improving");
        } else if (context.getRunwayMonths() < 6) {
            title = "Extend runway beyond " + runway;
            summary = "Your current runway is %s, below the 6-month safety line.".formatted(runway);
            explain = "Cut discretionary spend and open a financing track now; both take months to land.";
            priority = "high";
            impact = Map.of("runwayStability", "Critical", "bufferSafety", "Low");
        } else {
            title = "Maintain runway at " + runway;
            summary = "Your current runway is healthy at %s. Maintaining this buffer provides strategic optionality."
                    .formatted(runway);
            explain = "Stable cash position allows for focused execution without immediate fundraising pressure.";
            priority = "high";
            impact = Map.of("runwayStability", "High", "bufferSafety", "Excellent");
        }
        return Recommendation.builder()
                .type("runway_optimization")
                .category("cash")
                .title(title)
                .action(title)
                .summary(summary)
                .reasoning(summary)
                .explain(explain)
                .impact(impact)
                .priority(priority)
                .confidence(1.0)
                .evidence(evidence)
                .dataSources(dataSources)
                .build();
    }

    private void topUp(List<Recommendation> recommendations, FinancialContext context, List<String> evidence,
                       List<Recommendation.DataSource> dataSources) {
        if (recommendations.size() < MIN_RECOMMENDATIONS && !hasType(recommendations, "scenario_planning")) {
            String summary = "Testing resilience against market volatility and growth acceleration opportunities.";
            recommendations.add(Recommendation.builder()
                    .type("scenario_planning")
                    .category("strategy")
                    .title("Dynamic Scenario Modeling (Upside/Downside)")
                    .action("Dynamic Scenario Modeling (Upside/Downside)")
                    .summary(summary)
                    .reasoning(summary)
                    .explain("Modeling a 25% revenue growth burst vs. a 15% market downturn.")
                    .impact(Map.of("riskMitigation", "High", "capitalizationReadiness", "100%"))
                    .priority("medium")
                    .confidence(0.9)
                    .evidence(evidence)
                    .dataSources(dataSources)
                    .build());
        }
        if (recommendations.size() < MIN_RECOMMENDATIONS && !hasType(recommendations, "data_automation")) {
            String status = "Data Source: " + (context.isHasRealData() ? "Connected" : "Sync Required");
            String summary = "Automating the flow between accounting and planning for zero-latency insights.";
            recommendations.add(Recommendation.builder()
                    .type("data_automation")
                    .category("operations")
                    .title("Enhance Real-time Financial Data Integrity")
                    .action("Enhance Real-time Financial Data Integrity")
                    .summary(summary)
                    .reasoning(summary)
                    .explain("Ensuring all %s connectors provide granular visibility."
                            .formatted(context.isHasRealData() ? "active" : "pending"))
                    .impact(Map.of("insightLatency", "-90%", "decisionSpeed", "Accelerated"))
                    .priority("low")
                    .confidence(1.0)
                    .evidence(List.of(status))
                    .dataSources(List.of(new Recommendation.DataSource("data_connection", "connector_status", status)))
                    .build());
        }
    }

    private static boolean hasType(List<Recommendation> recommendations, String type) {
        return recommendations.stream().anyMatch(r -> type.equals(r.getType()));
    }

    private static List<String> baseEvidence(FinancialContext context) {
        return List.of(
                "Cash: " + money(context.getCashBalance()),
                "Burn: " + money(context.getBurnRate()) + "/mo",
                "Runway: %.1fm".formatted(context.getRunwayMonths()));
    }

    private static List<Recommendation.DataSource> dataSources(List<String> evidence) {
        List<Recommendation.DataSource> sources = new ArrayList<>();
        for (int i = 0; i < evidence.size(); i++) {
            sources.add(new Recommendation.DataSource("financial_metric", "metric_" + i, evidence.get(i)));
        }
        return List.copyOf(sources);
    }

    private static <T> List<T> append(List<T> list, T item) {
        List<T> copy = new ArrayList<>(list);
        copy.add(item);
        return List.copyOf(copy);
    }

    private static Double targetRunway(Map<String, Object> constraints) {
        if (constraints == null) {
            return null;
        }
        Object target = constraints.get("targetRunwayMonths");
        return target instanceof Number number ? number.doubleValue() : null;
    }

    private static double figure(Map<String, Double> calculations, String key, double fallback) {
        if (calculations != null) {
            Double value = calculations.get(key);
            if (value != null && !value.isNaN() && !value.isInfinite()) {
                return value;
            }
        }
        return fallback;
    }

    private static String months(FinancialContext context) {
        return "%.1f months".formatted(context.getRunwayMonths());
    }

    static String money(Double value) {
        return "$%,.0f".formatted(value == null ? 0 : value);
    }

    private static String percent(double fraction) {
        return "%.1f%%".formatted(fraction * 100);
    }

    private static double orZero(Double value) {
        return value == null ? 0 : value;
    }
}
