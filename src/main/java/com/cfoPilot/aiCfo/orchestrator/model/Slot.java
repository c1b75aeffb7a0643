package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

/**
 * One extracted entity: the text it came from and its canonical numeric value.
 */
@Value
@Builder
public class Slot {
    String rawValue;
    Double normalizedValue;
    String currency;
    double confidence;
    String unit;
}
