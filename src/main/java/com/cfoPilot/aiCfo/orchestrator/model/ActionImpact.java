package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ActionImpact {
    Double runwayDeltaMonths;
    /** Fraction of current runway, e.g. 0.2 for +20%. */
    Double runwayDeltaPercent;
    Double burnDelta;
    Double costDelta;
    /** Burn drops to zero or below, so runway no longer has a finite value. */
    boolean runwayUnbounded;
}
