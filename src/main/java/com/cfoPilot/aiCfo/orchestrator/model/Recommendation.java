package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * One staged recommendation shown to the user.
 */
@Value
@Builder
public class Recommendation {
    String type;
    String category;
    String title;
    String action;
    String summary;
    String reasoning;
    String explain;
    Map<String, String> impact;
    String priority;
    double confidence;
    List<String> evidence;
    List<DataSource> dataSources;

    /**
     * Identity used for deduplication: type, category and the impact pairs in key order.
     */
    public String signature() {
        String impactPairs = impact == null ? "" : new TreeMap<>(impact).entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.joining(","));
        return type + "|" + category + "|" + impactPairs;
    }

    @Value
    public static class DataSource {
        String type;
        String id;
        String snippet;
    }
}
