package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * Result of classifying one query. Immutable; the slot map is copied on construction.
 */
@Value
public class IntentClassification {

    IntentType intent;
    double confidence;
    Map<SlotName, Slot> slots;
    boolean usedFallback;
    String modelUsed;
    String originalInput;

    @Builder(toBuilder = true)
    private IntentClassification(IntentType intent, double confidence, Map<SlotName, Slot> slots,
                                 boolean usedFallback, String modelUsed, String originalInput) {
        this.intent = intent;
        this.confidence = confidence;
        this.slots = slots == null ? Map.of() : Map.copyOf(slots);
        this.usedFallback = usedFallback;
        this.modelUsed = modelUsed;
        this.originalInput = originalInput;
    }

    public Optional<Double> numericSlot(SlotName name) {
        Slot slot = slots.get(name);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.getNormalizedValue());
    }
}
