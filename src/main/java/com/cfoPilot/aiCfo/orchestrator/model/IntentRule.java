package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword rule for the pattern-based classifier.
 * Indicators are matched against the lowercased query.
 */
@Value
@Builder
public class IntentRule {
    IntentType intent;
    @Singular
    List<Pattern> indicators;
    double base;
    double min;
    double max;
    @Singular
    Set<SlotName> relevantSlots;
}
