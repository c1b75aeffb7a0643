package com.cfoPilot.aiCfo.repository.memory;

import com.cfoPilot.aiCfo.repository.ConnectorRepository;
import com.cfoPilot.aiCfo.repository.FinancialModelRepository;
import com.cfoPilot.aiCfo.repository.OrgRoleRepository;
import com.cfoPilot.aiCfo.repository.OverviewMetricsProvider;
import com.cfoPilot.aiCfo.repository.TransactionRepository;
import com.cfoPilot.aiCfo.repository.model.Connector;
import com.cfoPilot.aiCfo.repository.model.FinancialModel;
import com.cfoPilot.aiCfo.repository.model.ModelRun;
import com.cfoPilot.aiCfo.repository.model.ModelRunStatus;
import com.cfoPilot.aiCfo.repository.model.OrgRole;
import com.cfoPilot.aiCfo.repository.model.OverviewMetrics;
import com.cfoPilot.aiCfo.repository.model.Transaction;
import com.cfoPilot.aiCfo.repository.model.TransactionAggregate;
import com.cfoPilot.aiCfo.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory store for the read side of an org's financial data:
 * models and runs, connectors, transactions, roles and overview metrics.
 * Optionally seeded from classpath JSON files under data/.
 */
@Slf4j
@Repository
public class InMemoryFinancialStore implements FinancialModelRepository, ConnectorRepository,
        TransactionRepository, OrgRoleRepository, OverviewMetricsProvider {

    // Map collection names to JSON file paths in resources/data
    private static final Map<String, String> COLLECTION_TO_FILE_MAP = Map.of(
            "models", "data/models.json",
            "modelRuns", "data/modelRuns.json",
            "connectors", "data/connectors.json",
            "transactions", "data/transactions.json",
            "orgRoles", "data/orgRoles.json",
            "overview", "data/overview.json"
    );

    private final Clock clock;
    private final Map<String, FinancialModel> models = new ConcurrentHashMap<>();
    private final Map<String, ModelRun> runs = new ConcurrentHashMap<>();
    private final List<Connector> connectors = new CopyOnWriteArrayList<>();
    private final List<Transaction> transactions = new CopyOnWriteArrayList<>();
    private final Map<String, String> roles = new ConcurrentHashMap<>();
    private final Map<String, OverviewMetrics> overviews = new ConcurrentHashMap<>();

    public InMemoryFinancialStore(Clock clock,
                                  @Value("${ai-cfo.data.seed-enabled:true}") boolean seedEnabled) {
        this.clock = clock;
        if (seedEnabled) {
            seed();
        }
    }

    private void seed() {
        JsonFileLoader.loadAsListOrEmpty(COLLECTION_TO_FILE_MAP.get("models"), FinancialModel.class)
                .forEach(this::saveModel);
        JsonFileLoader.loadAsListOrEmpty(COLLECTION_TO_FILE_MAP.get("modelRuns"), ModelRun.class)
                .forEach(this::saveRun);
        JsonFileLoader.loadAsListOrEmpty(COLLECTION_TO_FILE_MAP.get("connectors"), Connector.class)
                .forEach(this::saveConnector);
        JsonFileLoader.loadAsListOrEmpty(COLLECTION_TO_FILE_MAP.get("transactions"), Transaction.class)
                .forEach(this::saveTransaction);
        JsonFileLoader.loadAsListOrEmpty(COLLECTION_TO_FILE_MAP.get("orgRoles"), OrgRole.class)
                .forEach(this::saveRole);
        JsonFileLoader.loadAsListOrEmpty(COLLECTION_TO_FILE_MAP.get("overview"), OverviewMetrics.class)
                .forEach(this::saveOverview);
        log.info("Seeded financial store - models: {}, runs: {}, connectors: {}, transactions: {}, roles: {}",
                models.size(), runs.size(), connectors.size(), transactions.size(), roles.size());
    }

    public FinancialModel saveModel(FinancialModel model) {
        FinancialModel stored = model.toBuilder()
                .id(model.getId() != null ? model.getId() : UUID.randomUUID().toString())
                .createdAt(model.getCreatedAt() != null ? model.getCreatedAt() : clock.instant())
                .assumptions(model.getAssumptions() != null ? new HashMap<>(model.getAssumptions()) : new HashMap<>())
                .build();
        models.put(stored.getId(), stored);
        return stored;
    }

    public void saveConnector(Connector connector) {
        connectors.add(connector);
    }

    public void saveTransaction(Transaction transaction) {
        transactions.add(transaction);
    }

    public void saveRole(OrgRole role) {
        roles.put(roleKey(role.getOrgId(), role.getUserId()), role.getRole());
    }

    public void saveOverview(OverviewMetrics overview) {
        overviews.put(overview.getOrgId(), overview);
    }

    @Override
    public Optional<FinancialModel> findLatestModel(String orgId) {
        return models.values().stream()
                .filter(model -> orgId.equals(model.getOrgId()))
                .max(Comparator.comparing(FinancialModel::getCreatedAt));
    }

    @Override
    public Optional<ModelRun> findLatestCompletedRun(String orgId) {
        return findLatestModel(orgId).flatMap(model -> runs.values().stream()
                .filter(run -> model.getId().equals(run.getModelId()))
                .filter(run -> run.getStatus() == ModelRunStatus.DONE)
                .max(Comparator.comparing(ModelRun::getCreatedAt)));
    }

    @Override
    public Optional<ModelRun> findRunById(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public ModelRun saveRun(ModelRun run) {
        ModelRun stored = run.toBuilder()
                .id(run.getId() != null ? run.getId() : UUID.randomUUID().toString())
                .createdAt(run.getCreatedAt() != null ? run.getCreatedAt() : clock.instant())
                .build();
        runs.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public Optional<FinancialModel> mergeAssumptions(String modelId, Map<String, ?> changes) {
        FinancialModel updated = models.computeIfPresent(modelId, (id, model) -> {
            Map<String, Object> merged = new HashMap<>();
            if (model.getAssumptions() != null) {
                merged.putAll(model.getAssumptions());
            }
            merged.putAll(changes);
            return model.toBuilder().assumptions(merged).build();
        });
        return Optional.ofNullable(updated);
    }

    @Override
    public long countLive(String orgId) {
        return connectors.stream()
                .filter(connector -> orgId.equals(connector.getOrgId()))
                .filter(Connector::isLive)
                .count();
    }

    @Override
    public long count(String orgId) {
        return transactions.stream()
                .filter(tx -> orgId.equals(tx.getOrgId()) && !tx.isDuplicate())
                .count();
    }

    @Override
    public TransactionAggregate aggregateSince(String orgId, LocalDate since) {
        List<Transaction> matching = transactions.stream()
                .filter(tx -> orgId.equals(tx.getOrgId()) && !tx.isDuplicate())
                .filter(tx -> tx.getDate() != null && !tx.getDate().isBefore(since))
                .sorted(Comparator.comparing(Transaction::getDate).reversed())
                .toList();
        if (matching.isEmpty()) {
            return TransactionAggregate.empty(since);
        }

        double inflow = 0;
        double outflow = 0;
        for (Transaction tx : matching) {
            double amount = tx.getAmount() != null ? tx.getAmount() : 0;
            if (amount >= 0) {
                inflow += amount;
            } else {
                outflow += -amount;
            }
        }
        Transaction latest = matching.get(0);
        return TransactionAggregate.builder()
                .count(matching.size())
                .totalInflow(inflow)
                .totalOutflow(outflow)
                .latestDate(latest.getDate())
                .latestDescription(latest.getDescription())
                .since(since)
                .build();
    }

    @Override
    public Optional<String> findRole(String orgId, String userId) {
        return Optional.ofNullable(roles.get(roleKey(orgId, userId)));
    }

    @Override
    public Optional<OverviewMetrics> getOverview(String orgId) {
        return Optional.ofNullable(overviews.get(orgId));
    }

    private static String roleKey(String orgId, String userId) {
        return orgId + ":" + userId;
    }
}
