package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PlannerAction {
    ActionType type;
    Operation operation;
    ActionParams params;
    boolean requiresApproval;
    String approvalReason;
    ActionImpact impact;

    public static PlannerAction of(ActionParams params) {
        return PlannerAction.builder()
                .type(params.operation().getActionType())
                .operation(params.operation())
                .params(params)
                .build();
    }
}
