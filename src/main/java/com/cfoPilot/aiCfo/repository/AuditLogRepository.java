package com.cfoPilot.aiCfo.repository;

import com.cfoPilot.aiCfo.repository.model.AuditLogEntry;

import java.util.Collection;
import java.util.List;

public interface AuditLogRepository {

    AuditLogEntry append(AuditLogEntry entry);

    /**
     * Newest first, restricted to the given actions.
     */
    List<AuditLogEntry> findRecent(String orgId, Collection<String> actions, int limit);
}
