package com.cfoPilot.aiCfo.repository.memory;

import com.cfoPilot.aiCfo.repository.AuditLogRepository;
import com.cfoPilot.aiCfo.repository.model.AuditLogEntry;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryAuditLogRepository implements AuditLogRepository {

    private final Clock clock;
    private final List<AuditLogEntry> entries = new CopyOnWriteArrayList<>();

    public InMemoryAuditLogRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AuditLogEntry append(AuditLogEntry entry) {
        if (entry.getId() == null) {
            entry.setId(UUID.randomUUID().toString());
        }
        if (entry.getCreatedAt() == null) {
            entry.setCreatedAt(clock.instant());
        }
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditLogEntry> findRecent(String orgId, Collection<String> actions, int limit) {
        return entries.stream()
                .filter(entry -> orgId.equals(entry.getOrgId()))
                .filter(entry -> actions.contains(entry.getAction()))
                .sorted(Comparator.comparing(AuditLogEntry::getCreatedAt).reversed())
                .limit(limit)
                .toList();
    }
}
