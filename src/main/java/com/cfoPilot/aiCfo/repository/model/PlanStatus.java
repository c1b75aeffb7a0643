package com.cfoPilot.aiCfo.repository.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum PlanStatus {
    DRAFT("draft"),
    QUEUED("queued"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    PlanStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<PlanStatus> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.wireName.equalsIgnoreCase(value.trim()))
                .findFirst();
    }

    @JsonCreator
    static PlanStatus parse(String value) {
        return fromWire(value).orElseThrow(() -> new IllegalArgumentException("Unknown plan status: " + value));
    }
}
