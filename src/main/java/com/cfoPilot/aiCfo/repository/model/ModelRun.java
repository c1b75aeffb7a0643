package com.cfoPilot.aiCfo.repository.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One execution of a financial model. Scenario runs carry assumption overrides.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ModelRun {
    private String id;
    private String modelId;
    private String orgId;
    private String runType; // "baseline" or "scenario"
    private ModelRunStatus status;
    private Map<String, Object> overrides;
    private FinancialSummary summary;
    private Instant createdAt;
    private Instant finishedAt;
}
