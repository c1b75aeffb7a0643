package com.cfoPilot.aiCfo.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Entities the classifier can pull out of a query.
 */
public enum SlotName {
    CASH("cash"),
    BURN_RATE("burn_rate"),
    RUNWAY_MONTHS("runway_months"),
    REVENUE_GROWTH("revenue_growth"),
    BASE_REVENUE("base_revenue"),
    MONTHS("months"),
    HIRE_COUNT("hire_count"),
    ANNUAL_SALARY("annual_salary"),
    EXPENSES("expenses"),
    EXPENSE_CHANGE("expense_change");

    private final String wireName;

    SlotName(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<SlotName> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(slot -> slot.wireName.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
