package com.cfoPilot.aiCfo.job;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A job accepted for an external runner (Monte Carlo, model run).
 */
@Value
@Builder
public class QueuedJob {
    String id;
    String jobType;
    String orgId;
    String objectId;
    Map<String, Object> params;
    Instant queuedAt;
}
