package com.cfoPilot.aiCfo.orchestrator.util;

import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.SlotName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IntentMatcherTest {

    private final IntentMatcher matcher = IntentMatcher.standard();

    @Test
    void burnQuestionMatchesBurnRateWithHighConfidence() {
        IntentMatcher.Match match = matcher.match("what is our burn rate?", Set.of());

        assertThat(match.intent()).isEqualTo(IntentType.BURN_RATE_CALCULATION);
        assertThat(match.confidence()).isGreaterThanOrEqualTo(0.90);
    }

    @Test
    void runwayWinsWhenRunwayIsAsked() {
        IntentMatcher.Match match = matcher.match(
                "cash is $600,000 and burn is $50,000/month, what is our runway?",
                EnumSet.of(SlotName.CASH, SlotName.BURN_RATE));

        assertThat(match.intent()).isEqualTo(IntentType.RUNWAY_CALCULATION);
        assertThat(match.confidence()).isGreaterThan(0.90);
    }

    @Test
    void explicitBurnAskOverridesRunwayRule() {
        IntentMatcher.Match match = matcher.match("what is our burn if we have 12 months of runway?", Set.of());

        assertThat(match.intent()).isEqualTo(IntentType.BURN_RATE_CALCULATION);
    }

    @Test
    void monteCarloIsCheckedBeforeScenario() {
        IntentMatcher.Match match = matcher.match("run a monte carlo simulation of our cash", Set.of());

        assertThat(match.intent()).isEqualTo(IntentType.MONTE_CARLO);
    }

    @Test
    void unmatchedQueryFallsBackToStrategy() {
        IntentMatcher.Match match = matcher.match("hello there", Set.of());

        assertThat(match.intent()).isEqualTo(IntentType.STRATEGY_RECOMMENDATION);
        assertThat(match.confidence()).isEqualTo(0.55);
        assertThat(match.matchedIndicators()).isZero();
    }

    @Test
    void confidenceIsClampedToRuleMaximum() {
        IntentMatcher.Match match = matcher.match(
                "runway: how long will cash last, months of cash left on our runway",
                EnumSet.of(SlotName.CASH, SlotName.BURN_RATE, SlotName.RUNWAY_MONTHS));

        assertThat(match.confidence()).isLessThanOrEqualTo(0.98);
    }
}
