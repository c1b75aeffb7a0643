package com.cfoPilot.aiCfo.repository.memory;

import com.cfoPilot.aiCfo.repository.PlanRepository;
import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.PlanStatus;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryPlanRepository implements PlanRepository {

    private static final Comparator<AiCfoPlan> NEWEST_FIRST =
            Comparator.comparing(AiCfoPlan::getCreatedAt).reversed();

    private final Clock clock;
    private final Map<String, AiCfoPlan> plans = new ConcurrentHashMap<>();

    public InMemoryPlanRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AiCfoPlan save(AiCfoPlan plan) {
        Instant now = clock.instant();
        AiCfoPlan stored = plan.toBuilder()
                .id(plan.getId() != null ? plan.getId() : UUID.randomUUID().toString())
                .createdAt(plan.getCreatedAt() != null ? plan.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        plans.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public Optional<AiCfoPlan> findById(String planId) {
        return Optional.ofNullable(plans.get(planId));
    }

    @Override
    public List<AiCfoPlan> findRecentByOrg(String orgId, int limit) {
        return plans.values().stream()
                .filter(plan -> orgId.equals(plan.getOrgId()))
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .toList();
    }

    @Override
    public List<AiCfoPlan> findByOrg(String orgId, PlanStatus status) {
        return plans.values().stream()
                .filter(plan -> orgId.equals(plan.getOrgId()))
                .filter(plan -> status == null || plan.getStatus() == status)
                .sorted(NEWEST_FIRST)
                .toList();
    }

    @Override
    public Optional<AiCfoPlan> update(String planId, UnaryOperator<AiCfoPlan> updater) {
        AiCfoPlan updated = plans.computeIfPresent(planId, (id, existing) ->
                updater.apply(existing).toBuilder()
                        .id(id)
                        .updatedAt(clock.instant())
                        .build());
        return Optional.ofNullable(updated);
    }
}
