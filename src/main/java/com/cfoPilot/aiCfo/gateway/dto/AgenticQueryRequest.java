package com.cfoPilot.aiCfo.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgenticQueryRequest {

    @NotBlank(message = "query cannot be blank")
    private String query;

    /**
     * Optional context; {@code modelRunId} is honored, other keys are passed on as constraints.
     */
    private Map<String, Object> context;
}
