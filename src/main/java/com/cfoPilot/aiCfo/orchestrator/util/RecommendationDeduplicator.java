package com.cfoPilot.aiCfo.orchestrator.util;

import com.cfoPilot.aiCfo.orchestrator.model.Recommendation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RecommendationDeduplicator {

    private RecommendationDeduplicator() {}

    /**
     * Keeps the first recommendation per {@link Recommendation#signature()}, preserving order.
     */
    public static List<Recommendation> deduplicate(List<Recommendation> recommendations) {
        Map<String, Recommendation> unique = new LinkedHashMap<>();
        for (Recommendation recommendation : recommendations) {
            unique.putIfAbsent(recommendation.signature(), recommendation);
        }
        return new ArrayList<>(unique.values());
    }
}
