package com.cfoPilot.aiCfo.job;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class InProcessJobQueueTest {

    private final AiGenerationWorker worker = mock(AiGenerationWorker.class);
    private final InProcessJobQueue queue = new InProcessJobQueue(worker, Runnable::run,
            Clock.fixed(Instant.parse("2026-10-01T10:00:00Z"), ZoneOffset.UTC));

    @Test
    void aiGenerationJobIsHandedToWorker() {
        AiGenerationJob job = AiGenerationJob.builder().planId("plan-1").orgId("org-1")
                .calculations(Map.of()).evidence(List.of()).build();

        String jobId = queue.enqueueAiGeneration(job);

        verify(worker).process(eq(jobId), eq(job));
        assertThat(queue.pendingJobs()).isEmpty();
    }

    @Test
    void simulationJobsWaitForTheRunner() {
        String monteCarloId = queue.enqueueMonteCarlo("org-1", "model-1", 5000, null);
        String runId = queue.enqueueModelRun("org-1", "run-1");

        assertThat(queue.pendingJobs()).extracting(QueuedJob::getId).containsExactly(monteCarloId, runId);
        assertThat(queue.pendingJobs().get(0).getJobType()).isEqualTo(InProcessJobQueue.MONTE_CARLO);
        assertThat(queue.pendingJobs().get(0).getParams()).containsEntry("numSimulations", 5000);
        assertThat(queue.pendingJobs().get(1).getObjectId()).isEqualTo("run-1");
    }
}
