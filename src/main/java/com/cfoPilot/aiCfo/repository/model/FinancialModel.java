package com.cfoPilot.aiCfo.repository.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class FinancialModel {
    private String id;
    private String orgId;
    private String name;
    private Integer version;
    private Map<String, Object> assumptions;
    private Instant createdAt;
}
