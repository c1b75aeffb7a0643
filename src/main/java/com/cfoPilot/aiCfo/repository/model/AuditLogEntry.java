package com.cfoPilot.aiCfo.repository.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLogEntry {
    private String id;
    private String orgId;
    private String actorUserId;
    private String action;
    private String objectType;
    private String objectId;
    private Map<String, Object> meta;
    private Instant createdAt;
}
