package com.cfoPilot.aiCfo.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DocType {
    MODEL_ASSUMPTION("model_assumption"),
    HISTORICAL("historical"),
    POLICY("policy"),
    RECOMMENDATION("recommendation"),
    AUDIT_LOG("audit_log"),
    TEMPLATE("template");

    private final String wireName;

    DocType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
