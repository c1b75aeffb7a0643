package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PlannerResult {
    List<PlannerAction> actions;
    PlanValidation validation;
    boolean requiresApproval;
    /** Set only when an action crossed the approval gate. */
    Double approvalThreshold;
}
