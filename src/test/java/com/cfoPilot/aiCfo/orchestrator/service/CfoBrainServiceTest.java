package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.orchestrator.model.FinancialContext;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.Recommendation;
import com.cfoPilot.aiCfo.repository.model.FinancialSummary;
import com.cfoPilot.aiCfo.repository.model.OverviewMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CfoBrainServiceTest {

    private final CfoBrainService brain = new CfoBrainService();

    @Test
    void runSummaryTakesPrecedenceOverOverview() {
        FinancialContext context = brain.resolveContext(
                FinancialSummary.builder().cashBalance(1_800_000d).burnRate(120_000d).revenue(95_000d).build(),
                OverviewMetrics.builder().monthlyRevenue(1d).monthlyBurnRate(1d).build());

        assertThat(context.isHasRealData()).isTrue();
        assertThat(context.getRunwayMonths()).isEqualTo(15.0);
        assertThat(context.getTopExpense()).isEqualTo("OpEx");
    }

    @Test
    void overviewCashIsRunwayTimesBurn() {
        FinancialContext context = brain.resolveContext(null, OverviewMetrics.builder()
                .monthlyRevenue(95_000d).monthlyBurnRate(120_000d).cashRunway(15d).build());

        assertThat(context.getCashBalance()).isEqualTo(1_800_000);
        assertThat(context.isHasRealData()).isTrue();
    }

    @Test
    void noDataUsesBaseline() {
        FinancialContext context = brain.resolveContext(null, OverviewMetrics.builder().build());

        assertThat(context.isHasRealData()).isFalse();
        assertThat(context.getCashBalance()).isEqualTo(500_000);
    }

    @Test
    void alwaysAtLeastThreeDistinctRecommendations() {
        for (IntentType intent : IntentType.values()) {
            List<Recommendation> recommendations =
                    brain.generate("help", Map.of(), FinancialContext.baseline(), intent);

            assertThat(recommendations).hasSizeGreaterThanOrEqualTo(3);
            assertThat(recommendations).extracting(Recommendation::signature).doesNotHaveDuplicates();
        }
    }

    @Test
    void runwayRecommendationComesFirstForRunwayIntent() {
        List<Recommendation> recommendations = brain.generate("What is our runway?", Map.of(),
                FinancialContext.baseline(), IntentType.RUNWAY_CALCULATION);

        Recommendation primary = recommendations.get(0);
        assertThat(primary.getType()).isEqualTo("runway_optimization");
        assertThat(primary.getPriority()).isEqualTo("high");
        assertThat(primary.getEvidence()).containsExactly("Cash: $500,000", "Burn: $80,000/mo", "Runway: 6.3m");
        assertThat(primary.getDataSources()).extracting(Recommendation.DataSource::getId)
                .containsExactly("metric_0", "metric_1", "metric_2");
    }

    @Test
    void targetRunwayConstraintShapesRunwayRecommendation() {
        List<Recommendation> recommendations = brain.generate("runway", Map.of("targetRunwayMonths", 18),
                FinancialContext.baseline(), IntentType.RUNWAY_CALCULATION);

        assertThat(recommendations.get(0).getTitle()).isEqualTo("Extend runway from 6.3 months to 18 months");
    }

    @Test
    void runwayExplanationUsesCalculatedFigure() {
        List<Recommendation> recommendations = brain.generate("What is our runway?", Map.of(),
                FinancialContext.baseline(), IntentType.RUNWAY_CALCULATION);

        String text = brain.explain("What is our runway?", IntentType.RUNWAY_CALCULATION, recommendations,
                FinancialContext.baseline(), Map.of("runway", 12.0));

        assertThat(text).startsWith("Based on your current financial position, your cash runway is approximately 12.0 months.");
    }

    @Test
    void burnExplanationQuotesBurn() {
        List<Recommendation> recommendations = brain.generate("burn", Map.of(),
                FinancialContext.baseline(), IntentType.BURN_RATE_CALCULATION);

        String text = brain.explain("What is our burn?", IntentType.BURN_RATE_CALCULATION, recommendations,
                FinancialContext.baseline(), Map.of());

        assertThat(text).startsWith("Your monthly burn rate is currently $80,000.");
    }

    @Test
    void revenueStrategyQuestionListsStrategies() {
        List<Recommendation> recommendations = brain.generate("revenue strategies", Map.of(),
                FinancialContext.baseline(), IntentType.REVENUE_FORECAST);

        String text = brain.explain("What revenue strategies should we use?", IntentType.REVENUE_FORECAST,
                recommendations, FinancialContext.baseline(), Map.of());

        assertThat(text).contains("Customer Acquisition Optimization").contains("$67,000");
    }

    @Test
    void emptyRecommendationsStillProduceAnswer() {
        String text = brain.explain("anything", IntentType.RISK_ANALYSIS, List.of(), FinancialContext.baseline(), Map.of());

        assertThat(text).contains("\"anything\"");
    }
}
