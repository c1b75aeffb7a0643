package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Agent-style view of one answered query: the reasoning steps, sources and next questions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentTrace {

    private String answer;

    private String intent;

    private double confidence;

    private List<Thought> thoughts;

    private List<Recommendation.DataSource> dataSources;

    private Map<String, Double> calculations;

    private List<Recommendation> recommendations;

    private List<String> followUpQuestions;

    private boolean requiresApproval;

    private String approvalReason;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thought {
        private int step;
        private String thought;
        private String observation;
    }
}
