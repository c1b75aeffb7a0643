package com.cfoPilot.aiCfo.repository;

import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.PlanStatus;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface PlanRepository {

    /**
     * Stores the plan, assigning an id and timestamps when missing.
     */
    AiCfoPlan save(AiCfoPlan plan);

    Optional<AiCfoPlan> findById(String planId);

    /**
     * Newest first.
     */
    List<AiCfoPlan> findRecentByOrg(String orgId, int limit);

    /**
     * Newest first; a null status means all statuses.
     */
    List<AiCfoPlan> findByOrg(String orgId, PlanStatus status);

    /**
     * Atomically replaces the stored plan with {@code updater}'s result.
     */
    Optional<AiCfoPlan> update(String planId, UnaryOperator<AiCfoPlan> updater);
}
