package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one executed action. Calculations carry {@code value};
 * side-effecting operations carry the id of what they created.
 */
@Value
@Builder
public class ExecutionResult {
    Operation operation;
    ActionParams params;
    Double value;
    String referenceId;
    String message;

    public boolean hasValue() {
        return value != null;
    }
}
