package com.cfoPilot.aiCfo.job;

import com.cfoPilot.aiCfo.gateway.util.IdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;

/**
 * Job queue backed by the pipeline executor.
 *
 * AI generation jobs are consumed in-process by {@link AiGenerationWorker}. Monte Carlo and
 * model-run jobs are recorded for the simulation runner, which lives outside this service.
 */
@Slf4j
@Service
public class InProcessJobQueue implements JobQueue {

    public static final String AI_GENERATION = "ai_generation";
    public static final String MONTE_CARLO = "monte_carlo";
    public static final String MODEL_RUN = "model_run";

    private final AiGenerationWorker aiGenerationWorker;
    private final Executor executor;
    private final Clock clock;
    private final Queue<QueuedJob> pending = new ConcurrentLinkedQueue<>();

    public InProcessJobQueue(AiGenerationWorker aiGenerationWorker,
                             @Qualifier("pipelineExecutor") Executor executor,
                             Clock clock) {
        this.aiGenerationWorker = aiGenerationWorker;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public String enqueueAiGeneration(AiGenerationJob job) {
        String jobId = UUID.randomUUID().toString();
        log.info("Enqueued AI generation job - jobId: {}, planId: {}, orgId: {}",
                jobId, job.getPlanId(), IdMasker.mask(job.getOrgId()));
        executor.execute(() -> aiGenerationWorker.process(jobId, job));
        return jobId;
    }

    @Override
    public String enqueueMonteCarlo(String orgId, String modelId, int numSimulations, Long randomSeed) {
        Map<String, Object> params = new HashMap<>();
        params.put("numSimulations", numSimulations);
        params.put("randomSeed", randomSeed);
        return record(MONTE_CARLO, orgId, modelId, params);
    }

    @Override
    public String enqueueModelRun(String orgId, String modelRunId) {
        return record(MODEL_RUN, orgId, modelRunId, Map.of());
    }

    /**
     * Jobs waiting for the simulation runner, oldest first.
     */
    public List<QueuedJob> pendingJobs() {
        return new ArrayList<>(pending);
    }

    private String record(String jobType, String orgId, String objectId, Map<String, Object> params) {
        QueuedJob job = QueuedJob.builder()
                .id(UUID.randomUUID().toString())
                .jobType(jobType)
                .orgId(orgId)
                .objectId(objectId)
                .params(params)
                .queuedAt(clock.instant())
                .build();
        pending.add(job);
        log.info("Enqueued {} job - jobId: {}, objectId: {}, orgId: {}",
                jobType, job.getId(), objectId, IdMasker.mask(orgId));
        return job.getId();
    }
}
