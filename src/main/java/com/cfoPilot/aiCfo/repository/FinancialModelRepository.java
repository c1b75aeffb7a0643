package com.cfoPilot.aiCfo.repository;

import com.cfoPilot.aiCfo.repository.model.FinancialModel;
import com.cfoPilot.aiCfo.repository.model.ModelRun;

import java.util.Map;
import java.util.Optional;

public interface FinancialModelRepository {

    Optional<FinancialModel> findLatestModel(String orgId);

    /**
     * Most recent run with status done for the org's latest model.
     */
    Optional<ModelRun> findLatestCompletedRun(String orgId);

    Optional<ModelRun> findRunById(String runId);

    ModelRun saveRun(ModelRun run);

    /**
     * Merges the given values into the model's assumptions.
     *
     * @return the updated model, empty when the model does not exist
     */
    Optional<FinancialModel> mergeAssumptions(String modelId, Map<String, ?> changes);
}
