package com.cfoPilot.aiCfo.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApplyPlanRequest {

    /**
     * Assumption overrides merged over the base run's overrides.
     */
    private Map<String, Object> changes;
}
