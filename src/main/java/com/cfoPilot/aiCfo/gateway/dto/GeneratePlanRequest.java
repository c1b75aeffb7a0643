package com.cfoPilot.aiCfo.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for plan generation. The acting user comes from the X-User-ID header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeneratePlanRequest {

    @NotBlank(message = "goal cannot be blank")
    private String goal;

    private String modelRunId;

    private Map<String, Object> constraints;
}
