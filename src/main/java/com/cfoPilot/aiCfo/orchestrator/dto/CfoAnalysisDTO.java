package com.cfoPilot.aiCfo.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO for the JSON object the CFO analysis prompt asks the model to return.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class CfoAnalysisDTO {

    private String naturalLanguage;

    private List<RecommendationDTO> recommendations;

    private List<String> risks;

    private List<String> warnings;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RecommendationDTO {
        private String type;
        private String category;
        private String title;
        private String summary;
        private String explain;
        private Map<String, String> impact;
        private String priority;
        private Double confidence;
    }
}
