package com.cfoPilot.aiCfo.orchestrator.service;

import com.cfoPilot.aiCfo.gateway.util.IdMasker;
import com.cfoPilot.aiCfo.orchestrator.model.DocType;
import com.cfoPilot.aiCfo.orchestrator.model.EvidenceDocument;
import com.cfoPilot.aiCfo.orchestrator.model.GroundingContext;
import com.cfoPilot.aiCfo.orchestrator.model.GroundingValidation;
import com.cfoPilot.aiCfo.orchestrator.model.IntentType;
import com.cfoPilot.aiCfo.orchestrator.model.Recommendation;
import com.cfoPilot.aiCfo.orchestrator.model.Slot;
import com.cfoPilot.aiCfo.orchestrator.model.SlotName;
import com.cfoPilot.aiCfo.repository.AuditLogRepository;
import com.cfoPilot.aiCfo.repository.FinancialModelRepository;
import com.cfoPilot.aiCfo.repository.PlanRepository;
import com.cfoPilot.aiCfo.repository.TransactionRepository;
import com.cfoPilot.aiCfo.repository.model.AiCfoPlan;
import com.cfoPilot.aiCfo.repository.model.AuditLogEntry;
import com.cfoPilot.aiCfo.repository.model.FinancialModel;
import com.cfoPilot.aiCfo.repository.model.FinancialSummary;
import com.cfoPilot.aiCfo.repository.model.ModelRun;
import com.cfoPilot.aiCfo.repository.model.TransactionAggregate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Grounding retriever - collects evidence from the org's own financial records.
 *
 * Probes (model, latest run, recent plans, audit trail, transactions) run concurrently,
 * each bounded by the probe timeout. A probe that fails or times out contributes nothing.
 */
@Slf4j
@Service
public class GroundingService {

    public static final int DEFAULT_TOP_K = 5;
    public static final int DEFAULT_MIN_EVIDENCE = 2;

    static final double MODEL_SCORE = 0.90;
    static final double RUN_SCORE = 0.85;
    static final double TRANSACTION_SCORE = 0.80;
    static final double RECOMMENDATION_SCORE = 0.75;
    static final double AUDIT_SCORE = 0.60;
    static final double INTENT_BOOST = 0.10;
    static final double MIN_CONFIDENCE = 0.6;

    private static final int RECENT_PLAN_LIMIT = 5;
    private static final int RECENT_AUDIT_LIMIT = 3;
    private static final List<String> AUDITED_ACTIONS =
            List.of("ai_plan_generated", "model_run_created", "assumption_updated");

    private final FinancialModelRepository financialModelRepository;
    private final PlanRepository planRepository;
    private final AuditLogRepository auditLogRepository;
    private final TransactionRepository transactionRepository;
    private final GroundingCache groundingCache;
    private final Executor executor;
    private final Clock clock;
    private final Duration probeTimeout;

    public GroundingService(FinancialModelRepository financialModelRepository,
                            PlanRepository planRepository,
                            AuditLogRepository auditLogRepository,
                            TransactionRepository transactionRepository,
                            GroundingCache groundingCache,
                            @Qualifier("pipelineExecutor") Executor executor,
                            Clock clock,
                            @Value("${ai-cfo.grounding.probe-timeout:3s}") Duration probeTimeout) {
        this.financialModelRepository = financialModelRepository;
        this.planRepository = planRepository;
        this.auditLogRepository = auditLogRepository;
        this.transactionRepository = transactionRepository;
        this.groundingCache = groundingCache;
        this.executor = executor;
        this.clock = clock;
        this.probeTimeout = probeTimeout;
    }

    public GroundingContext retrieve(String orgId, IntentType intent, Map<SlotName, Slot> slots) {
        return retrieve(orgId, intent, slots, DEFAULT_TOP_K);
    }

    /**
     * Retrieves the top-K evidence for the org and intent.
     *
     * @param orgId Organization
     * @param intent Classified intent, drives the score boosts
     * @param slots Extracted slots (logged only; evidence is org-level)
     * @param topK Number of evidence items kept
     * @return grounding context; never null
     */
    public GroundingContext retrieve(String orgId, IntentType intent, Map<SlotName, Slot> slots, int topK) {
        log.debug("Retrieving grounding - orgId: {}, intent: {}, slots: {}",
                IdMasker.mask(orgId), intent.getWireName(), slots == null ? 0 : slots.size());
        GroundingContext full = groundingCache.get(orgId, intent, () -> probe(orgId, intent));
        return limit(full, topK);
    }

    /**
     * Checks that the context is strong enough to answer from.
     */
    public GroundingValidation validateGrounding(GroundingContext context, int minEvidence) {
        List<String> issues = new ArrayList<>();
        int found = context.getEvidence() == null ? 0 : context.getEvidence().size();
        if (found < minEvidence) {
            issues.add("Insufficient evidence: found %d, need %d".formatted(found, minEvidence));
        }
        if (context.getConfidence() < MIN_CONFIDENCE) {
            issues.add("Low grounding confidence: %.2f".formatted(context.getConfidence()));
        }
        if (context.getModelState() == null) {
            issues.add("No model state available for grounding");
        }
        return GroundingValidation.builder()
                .sufficient(issues.isEmpty())
                .issues(issues)
                .build();
    }

    /**
     * Runs every probe and returns all scored evidence, sorted; top-K is applied by the caller.
     */
    GroundingContext probe(String orgId, IntentType intent) {
        long start = System.currentTimeMillis();
        LocalDate since = LocalDate.of(LocalDate.now(clock).getYear() - 1, 1, 1);

        CompletableFuture<Optional<FinancialModel>> modelFuture =
                probeAsync("model", () -> financialModelRepository.findLatestModel(orgId), Optional.empty());
        CompletableFuture<Optional<ModelRun>> runFuture =
                probeAsync("run", () -> financialModelRepository.findLatestCompletedRun(orgId), Optional.empty());
        CompletableFuture<List<AiCfoPlan>> plansFuture =
                probeAsync("plans", () -> planRepository.findRecentByOrg(orgId, RECENT_PLAN_LIMIT), List.of());
        CompletableFuture<List<AuditLogEntry>> auditFuture =
                probeAsync("audit", () -> auditLogRepository.findRecent(orgId, AUDITED_ACTIONS, RECENT_AUDIT_LIMIT),
                        List.of());
        CompletableFuture<TransactionAggregate> transactionsFuture =
                probeAsync("transactions", () -> transactionRepository.aggregateSince(orgId, since),
                        TransactionAggregate.empty(since));

        CompletableFuture.allOf(modelFuture, runFuture, plansFuture, auditFuture, transactionsFuture).join();

        List<EvidenceDocument> evidence = new ArrayList<>();
        Optional<FinancialModel> model = modelFuture.join();
        Optional<ModelRun> run = runFuture.join();
        model.map(this::modelEvidence).ifPresent(evidence::add);
        run.filter(r -> r.getSummary() != null).map(this::runEvidence).ifPresent(evidence::add);
        transactionsEvidence(transactionsFuture.join()).ifPresent(evidence::add);

        List<Recommendation> recentRecommendations = new ArrayList<>();
        for (AiCfoPlan plan : plansFuture.join()) {
            List<Recommendation> planRecommendations = plan.getPayload() == null
                    ? null : plan.getPayload().getRecommendations();
            if (planRecommendations == null || planRecommendations.isEmpty()) {
                continue;
            }
            recentRecommendations.addAll(planRecommendations);
            evidence.add(recommendationEvidence(plan, planRecommendations));
        }
        auditFuture.join().stream().map(this::auditEvidence).forEach(evidence::add);

        List<EvidenceDocument> scored = evidence.stream()
                .map(doc -> doc.withRelevanceScore(boost(doc, intent)))
                .sorted(Comparator.comparingDouble(EvidenceDocument::getRelevanceScore).reversed())
                .toList();

        log.info("Grounding probes completed - orgId: {}, evidence: {}, elapsed: {}ms",
                IdMasker.mask(orgId), scored.size(), System.currentTimeMillis() - start);

        return GroundingContext.builder()
                .evidence(scored)
                .modelState(model.map(FinancialModel::getAssumptions).orElse(null))
                .latestSummary(run.map(ModelRun::getSummary).orElse(null))
                .recentRecommendations(List.copyOf(recentRecommendations))
                .confidence(meanScore(scored))
                .build();
    }

    private <T> CompletableFuture<T> probeAsync(String name, Supplier<T> probe, T fallback) {
        return CompletableFuture.supplyAsync(probe, executor)
                .orTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    log.warn("Grounding probe '{}' failed: {}", name, e.toString());
                    return fallback;
                });
    }

    static double boost(EvidenceDocument doc, IntentType intent) {
        double score = doc.getRelevanceScore();
        boolean boosted = switch (doc.getDocType()) {
            case HISTORICAL -> intent.isRunwayRelated();
            case MODEL_ASSUMPTION -> intent == IntentType.SCENARIO_SIMULATION
                    || intent == IntentType.MONTE_CARLO
                    || intent == IntentType.ASSUMPTION_EDIT;
            case RECOMMENDATION -> intent == IntentType.STRATEGY_RECOMMENDATION;
            default -> false;
        };
        return boosted ? Math.min(1.0, score + INTENT_BOOST) : score;
    }

    private static GroundingContext limit(GroundingContext full, int topK) {
        List<EvidenceDocument> all = full.getEvidence();
        if (all.size() <= topK) {
            return full;
        }
        List<EvidenceDocument> kept = List.copyOf(all.subList(0, Math.max(0, topK)));
        return GroundingContext.builder()
                .evidence(kept)
                .modelState(full.getModelState())
                .latestSummary(full.getLatestSummary())
                .recentRecommendations(full.getRecentRecommendations())
                .confidence(meanScore(kept))
                .build();
    }

    private static double meanScore(List<EvidenceDocument> evidence) {
        return evidence.stream()
                .mapToDouble(EvidenceDocument::getRelevanceScore)
                .average()
                .orElse(0.5);
    }

    private EvidenceDocument modelEvidence(FinancialModel model) {
        Map<String, Object> assumptions = model.getAssumptions() == null ? Map.of() : model.getAssumptions();
        String content = "Financial model '%s' (version %s) with %d assumptions: %s".formatted(
                model.getName(), model.getVersion(), assumptions.size(),
                assumptions.entrySet().stream()
                        .map(entry -> entry.getKey() + "=" + entry.getValue())
                        .collect(Collectors.joining(", ")));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("modelId", model.getId());
        metadata.put("version", model.getVersion());
        return EvidenceDocument.builder()
                .id("model-" + model.getId())
                .docType(DocType.MODEL_ASSUMPTION)
                .content(content)
                .relevanceScore(MODEL_SCORE)
                .metadata(metadata)
                .timestamp(model.getCreatedAt())
                .build();
    }

    private EvidenceDocument runEvidence(ModelRun run) {
        FinancialSummary summary = run.getSummary();
        String content = "Latest %s model run: cash %s, burn %s/mo, runway %s months, revenue %s/mo".formatted(
                run.getRunType() == null ? "baseline" : run.getRunType(),
                money(summary.getCashBalance()), money(summary.getBurnRate()),
                summary.getRunwayMonths() == null ? "n/a" : "%.1f".formatted(summary.getRunwayMonths()),
                money(summary.getRevenue()));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("modelRunId", run.getId());
        metadata.put("modelId", run.getModelId());
        return EvidenceDocument.builder()
                .id("run-" + run.getId())
                .docType(DocType.HISTORICAL)
                .content(content)
                .relevanceScore(RUN_SCORE)
                .metadata(metadata)
                .timestamp(run.getFinishedAt() != null ? run.getFinishedAt() : run.getCreatedAt())
                .build();
    }

    private Optional<EvidenceDocument> transactionsEvidence(TransactionAggregate aggregate) {
        if (aggregate.getCount() == 0) {
            return Optional.empty();
        }
        String content = "Found %d recent transactions. Latest: %s on %s.".formatted(
                aggregate.getCount(), aggregate.getLatestDescription(), aggregate.getLatestDate());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("since", aggregate.getSince().toString());
        metadata.put("totalInflow", aggregate.getTotalInflow());
        metadata.put("totalOutflow", aggregate.getTotalOutflow());
        return Optional.of(EvidenceDocument.builder()
                .id("transactions-" + aggregate.getSince())
                .docType(DocType.HISTORICAL)
                .content(content)
                .relevanceScore(TRANSACTION_SCORE)
                .metadata(metadata)
                .timestamp(clock.instant())
                .build());
    }

    private EvidenceDocument recommendationEvidence(AiCfoPlan plan, List<Recommendation> recommendations) {
        String titles = recommendations.stream()
                .map(Recommendation::getTitle)
                .collect(Collectors.joining("; "));
        return EvidenceDocument.builder()
                .id("plan-" + plan.getId())
                .docType(DocType.RECOMMENDATION)
                .content("Previous plan '%s' recommended: %s".formatted(plan.getName(), titles))
                .relevanceScore(RECOMMENDATION_SCORE)
                .metadata(Map.of("planId", plan.getId()))
                .timestamp(plan.getCreatedAt())
                .build();
    }

    private EvidenceDocument auditEvidence(AuditLogEntry entry) {
        return EvidenceDocument.builder()
                .id("audit-" + entry.getId())
                .docType(DocType.AUDIT_LOG)
                .content("%s on %s %s at %s".formatted(
                        entry.getAction(), entry.getObjectType(), entry.getObjectId(), entry.getCreatedAt()))
                .relevanceScore(AUDIT_SCORE)
                .metadata(Map.of("action", entry.getAction()))
                .timestamp(entry.getCreatedAt())
                .build();
    }

    private static String money(Double value) {
        return value == null ? "n/a" : "$%,.0f".formatted(value);
    }
}
