package com.cfoPilot.aiCfo.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionType {
    CALCULATION("calculation"),
    SIMULATION("simulation"),
    MODEL_UPDATE("model_update"),
    RECOMMENDATION("recommendation");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
