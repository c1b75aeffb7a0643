package com.cfoPilot.aiCfo.orchestrator.prompt;

import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.SlotName;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * System prompt for LLM-based intent classification and entity extraction.
 */
public class IntentClassificationPrompt {

    private IntentClassificationPrompt() {}

    private static final String TEMPLATE = """
            You are a financial intent parser for a CFO assistant. Given a user query, return JSON with intent, slots, and confidence.

            Map to exactly one of these intents: %s

            Extract entities into these slot names when present: %s
            - Normalize amounts to plain numbers (remove commas, apply k/M/million multipliers).
            - Express growth rates and expense changes as fractions (8%% -> 0.08, "cut expenses by 20%%" -> -0.2).
            - Express durations in months.
            - Set currency to "USD" or "INR" when the query states it, otherwise null.
            Think like a CFO: understand the strategic intent behind the question.

            OUTPUT JSON schema:
            {
              "intent": "string (one of the listed intents)",
              "confidence": 0.0-1.0,
              "slots": {
                "slot_name": {
                  "value": "raw text",
                  "normalized_value": number,
                  "currency": "USD" | "INR" | null,
                  "confidence": 0.0-1.0,
                  "unit": "optional unit"
                }
              }
            }

            Respond ONLY with valid JSON, no other text.
            """;

    public static final String SYSTEM_PROMPT = TEMPLATE.formatted(
            Arrays.stream(IntentType.values()).map(IntentType::getWireName).collect(Collectors.joining(", ")),
            Arrays.stream(SlotName.values()).map(SlotName::getWireName).collect(Collectors.joining(", ")));
}
