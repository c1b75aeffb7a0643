package com.cfoPilot.aiCfo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ClassificationValidation {
    boolean valid;
    List<String> issues;
    boolean requiresClarification;
}
