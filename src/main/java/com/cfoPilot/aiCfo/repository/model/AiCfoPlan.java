package com.cfoPilot.aiCfo.repository.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted answer to a goal or query. Updated in place by the AI generation worker.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class AiCfoPlan {
    private String id;
    private String orgId;
    private String modelRunId;
    private String createdById;
    private String name;
    private String description;
    private PlanStatus status;
    private PlanPayload payload;
    private Instant createdAt;
    private Instant updatedAt;
}
