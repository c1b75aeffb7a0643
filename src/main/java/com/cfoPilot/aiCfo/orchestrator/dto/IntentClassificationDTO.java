package com.cfoPilot.aiCfo.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * DTO for the JSON object the classification prompt asks the model to return.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntentClassificationDTO {

    private String intent;

    private Double confidence;

    private Map<String, SlotDTO> slots;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlotDTO {
        /**
         * Raw text; the model sometimes returns a number here.
         */
        private Object value;

        @JsonProperty("normalized_value")
        private Object normalizedValue;

        private String currency;

        private Double confidence;

        private String unit;
    }
}
