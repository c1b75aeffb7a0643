package com.cfoPilot.aiCfo.repository;

import com.cfoPilot.aiCfo.repository.model.OverviewMetrics;

import java.util.Optional;

public interface OverviewMetricsProvider {

    Optional<OverviewMetrics> getOverview(String orgId);
}
