package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.orchestrator.model.AgentTrace;
import com.cfoPilot.aiCfo.orchestrator.model.EvidenceDocument;
import com.cfoPilot.aiCfo.orchestrator.model.ExecutionResult;
import com.cfoPilot.aiCfo.orchestrator.model.IntentClassification;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.Operation;
import com.cfoPilot.aiCfo.orchestrator.model.OrchestrationState;
import com.cfoPilot.aiCfo.orchestrator.model.PlannerAction;
import com.cfoPilot.aiCfo.orchestrator.model.Recommendation;
import com.cfoPilot.aiCfo.repository.model.PlanPayload;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a finished pipeline state into an agent trace: one thought per stage that ran.
 */
@Component
public class AgentTraceBuilder {

    public AgentTrace build(OrchestrationState state, PlanPayload payload) {
        List<AgentTrace.Thought> thoughts = new ArrayList<>();
        IntentClassification classification = state.getClassification();

        if (classification != null) {
            thoughts.add(new AgentTrace.Thought(thoughts.size() + 1,
                    "Classify the question",
                    "Intent %s at %.0f%% confidence via %s, %d slot(s) extracted".formatted(
                            classification.getIntent().getWireName(),
                            classification.getConfidence() * 100,
                            classification.isUsedFallback() ? "pattern matching" : classification.getModelUsed(),
                            classification.getSlots().size())));
        }
        if (state.getGrounding() != null) {
            thoughts.add(new AgentTrace.Thought(thoughts.size() + 1,
                    "Gather evidence from financial records",
                    "%d evidence item(s), grounding confidence %.2f".formatted(
                            state.getGrounding().getEvidence().size(), state.getGrounding().getConfidence())));
        }
        if (state.getPlannerResult() != null) {
            String operations = state.getPlannerResult().getActions().stream()
                    .map(PlannerAction::getOperation)
                    .map(Operation::getWireName)
                    .collect(Collectors.joining(", "));
            List<String> issues = state.getPlannerResult().getValidation().getIssues();
            thoughts.add(new AgentTrace.Thought(thoughts.size() + 1,
                    "Plan deterministic calculations",
                    issues.isEmpty()
                            ? "Planned: " + (operations.isEmpty() ? "none" : operations)
                            : "Issues: " + String.join("; ", issues)));
        }
        if (!state.getExecutionResults().isEmpty()) {
            String results = state.getExecutionResults().stream()
                    .map(AgentTraceBuilder::describe)
                    .collect(Collectors.joining("; "));
            thoughts.add(new AgentTrace.Thought(thoughts.size() + 1, "Execute actions", results));
        }
        thoughts.add(new AgentTrace.Thought(thoughts.size() + 1,
                "Compose the answer",
                state.getDegradedReason() == null
                        ? "Answered by the AI analyst"
                        : "Deterministic reasoning used: " + state.getDegradedReason().getDescription()));

        boolean requiresApproval = state.getPlannerResult() != null && state.getPlannerResult().isRequiresApproval();
        String approvalReason = requiresApproval
                ? state.getPlannerResult().getActions().stream()
                        .filter(PlannerAction::isRequiresApproval)
                        .map(PlannerAction::getApprovalReason)
                        .findFirst()
                        .orElse(null)
                : null;

        List<Recommendation> recommendations = payload.getRecommendations() == null
                ? List.of() : payload.getRecommendations();
        return AgentTrace.builder()
                .answer(payload.getNaturalText())
                .intent(payload.getIntent())
                .confidence(classification != null ? classification.getConfidence() : 1.0)
                .thoughts(thoughts)
                .dataSources(dataSources(state, recommendations))
                .calculations(payload.getCalculations() == null ? Map.of() : payload.getCalculations())
                .recommendations(recommendations)
                .followUpQuestions(followUpQuestions(classification != null ? classification.getIntent() : null))
                .requiresApproval(requiresApproval)
                .approvalReason(approvalReason)
                .build();
    }

    static List<String> followUpQuestions(IntentType intent) {
        if (intent == null) {
            return List.of("What's my current runway?", "What's my monthly burn rate?",
                    "Should I raise funding now?");
        }
        return switch (intent) {
            case RUNWAY_CALCULATION, CASH_SURVIVAL_ESTIMATION -> List.of(
                    "How can I extend my runway?",
                    "What are my biggest expenses?",
                    "Model a 20% reduction in burn rate");
            case BURN_RATE_CALCULATION -> List.of(
                    "Which categories are growing fastest?",
                    "Compare to last quarter",
                    "Show cost optimization opportunities");
            case SCENARIO_SIMULATION, MONTE_CARLO -> List.of(
                    "What are the risks of this scenario?",
                    "Compare with optimistic scenario",
                    "What cost cuts would offset this?");
            case REVENUE_FORECAST, PRICING_IMPACT, CHURN_IMPACT -> List.of(
                    "What strategies can help me accelerate revenue growth?",
                    "How does churn affect this forecast?",
                    "Model 12 months at a lower growth rate");
            case HIRE_IMPACT, HEADCOUNT_PLANNING -> List.of(
                    "How do these hires change my runway?",
                    "What if we delay hiring by a quarter?",
                    "Which roles have the highest payback?");
            case FUNDRAISING_READINESS -> List.of(
                    "How much should I raise?",
                    "What runway do investors expect?",
                    "What's the optimal fundraising timing?");
            case COST_OPTIMIZATION, MARGIN_IMPROVEMENT, ASSUMPTION_EDIT -> List.of(
                    "Show SaaS spending audit",
                    "Identify redundant subscriptions",
                    "What costs can be cut without affecting R&D?");
            default -> List.of(
                    "What's my current runway?",
                    "How can I improve profitability?",
                    "Should I raise funding now?");
        };
    }

    private static List<Recommendation.DataSource> dataSources(OrchestrationState state,
                                                               List<Recommendation> recommendations) {
        List<Recommendation.DataSource> sources = new ArrayList<>();
        if (state.getGrounding() != null) {
            for (EvidenceDocument doc : state.getGrounding().getEvidence()) {
                sources.add(new Recommendation.DataSource(doc.getDocType().getWireName(), doc.getId(), doc.getContent()));
            }
        }
        if (sources.isEmpty()) {
            recommendations.stream()
                    .filter(r -> r.getDataSources() != null)
                    .flatMap(r -> r.getDataSources().stream())
                    .distinct()
                    .forEach(sources::add);
        }
        return sources;
    }

    private static String describe(ExecutionResult result) {
        String name = result.getOperation().getWireName();
        if (result.hasValue()) {
            return "%s = %.2f".formatted(name, result.getValue());
        }
        return result.getMessage() != null ? name + ": " + result.getMessage() : name;
    }
}
