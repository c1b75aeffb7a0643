package com.cfoPilot.aiCfo.orchestrator.util;

import com.cfoPilot.aiCfo.orchestrator.model.IntentRule;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.SlotName;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates an ordered rule list against a lowercased query.
 *
 * Confidence = base + 0.02 per extra matched indicator + 0.02 per relevant extracted slot,
 * clamped to the rule's [min, max].
 */
public class IntentMatcher {

    static final double INDICATOR_BONUS = 0.02;
    static final double SLOT_BONUS = 0.02;

    /**
     * "what is our burn", "how long is the runway", "calculate runway". The nearest term after the ask wins.
     */
    private static final Pattern EXPLICIT_ASK = Pattern.compile(
            "\\b(?:what(?:'s|’s|\\s+is|\\s+are|\\s+was)?|how\\s+(?:much|long|fast|quickly)|calculate|compute|tell\\s+me|"
                    + "show(?:\\s+me)?|check|estimate|give\\s+me|determine)\\s+(?:[\\w$,.'/-]+\\s+){0,4}?(runway|burn)");

    private final List<IntentRule> rules;
    private final IntentRule defaultRule;

    public IntentMatcher(List<IntentRule> rules, IntentRule defaultRule) {
        this.rules = rules;
        this.defaultRule = defaultRule;
    }

    public static IntentMatcher standard() {
        return new IntentMatcher(IntentRules.RULES, IntentRules.DEFAULT);
    }

    /**
     * @param lowerQuery Lowercased query
     * @param extractedSlots Slots found by {@link SlotExtractor}
     */
    public Match match(String lowerQuery, Set<SlotName> extractedSlots) {
        IntentRule winner = null;
        int winnerHits = 0;
        for (IntentRule rule : rules) {
            int hits = countHits(rule, lowerQuery);
            if (hits > 0) {
                winner = rule;
                winnerHits = hits;
                break;
            }
        }

        if (winner == null) {
            winner = defaultRule;
            winnerHits = countHits(defaultRule, lowerQuery);
        } else if (winner.getIntent() == IntentType.RUNWAY_CALCULATION) {
            Optional<IntentRule> burn = findRule(IntentType.BURN_RATE_CALCULATION);
            if (burn.isPresent() && countHits(burn.get(), lowerQuery) > 0
                    && explicitlyAsked(lowerQuery).filter("burn"::equals).isPresent()) {
                winner = burn.get();
                winnerHits = countHits(winner, lowerQuery);
            }
        }

        return new Match(winner.getIntent(), confidence(winner, winnerHits, extractedSlots), winnerHits);
    }

    static double confidence(IntentRule rule, int hits, Set<SlotName> extractedSlots) {
        long relevant = extractedSlots.stream().filter(rule.getRelevantSlots()::contains).count();
        double raw = rule.getBase()
                + INDICATOR_BONUS * Math.max(0, hits - 1)
                + SLOT_BONUS * relevant;
        return Math.max(rule.getMin(), Math.min(rule.getMax(), raw));
    }

    /**
     * @return "runway" or "burn" when the query explicitly asks for one of them
     */
    static Optional<String> explicitlyAsked(String lowerQuery) {
        Matcher matcher = EXPLICIT_ASK.matcher(lowerQuery);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private Optional<IntentRule> findRule(IntentType intent) {
        return rules.stream().filter(rule -> rule.getIntent() == intent).findFirst();
    }

    private static int countHits(IntentRule rule, String lowerQuery) {
        int hits = 0;
        for (Pattern indicator : rule.getIndicators()) {
            if (indicator.matcher(lowerQuery).find()) {
                hits++;
            }
        }
        return hits;
    }

    public record Match(IntentType intent, double confidence, int matchedIndicators) {}
}
