package com.cfoPilot.aiCfo.repository.model;

import com.cfoPilot.aiCfo.orchestrator.model.AgentTrace;
import com.cfoPilot.aiCfo.orchestrator.model.Recommendation;
import com.cfoPilot.aiCfo.orchestrator.model.StructuredResponse;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Body of a plan record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PlanPayload {

    private String goal;

    private Map<String, Object> constraints;

    /**
     * Id of the AI generation job working on this plan.
     */
    private String jobId;

    /**
     * Intent wire name, or a meta label such as "system_status".
     */
    private String intent;

    private String naturalText;

    private List<Recommendation> recommendations;

    private Map<String, Double> calculations;

    private List<String> risks;

    private List<String> warnings;

    private StructuredResponse structuredResponse;

    private AgentTrace agentTrace;

    private Map<String, Object> metadata;

    private Instant generatedAt;

    @JsonIgnore
    public boolean hasNaturalText() {
        return naturalText != null && !naturalText.isBlank();
    }
}
