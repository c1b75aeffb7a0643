package com.cfoPilot.aiCfo.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Request context passed through the pipeline.
 * Contains the trusted user id from the header and the requestId used for log correlation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    private String orgId;

    /**
     * User ID from the X-User-ID header (trusted source).
     */
    private String userId;

    /**
     * Request ID for tracking and audit.
     */
    private String requestId;

    /**
     * Sanitized goal or query text.
     */
    private String query;

    /**
     * Optional model run the user asked about.
     */
    private String modelRunId;

    private Map<String, Object> constraints;

    /**
     * Timestamp when request was received at the gateway.
     */
    private Instant receivedAt;
}
