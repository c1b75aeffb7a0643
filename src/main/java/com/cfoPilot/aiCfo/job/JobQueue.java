package com.cfoPilot.aiCfo.job;

/**
 * Background job collaborator. Each method returns the id of the queued job.
 */
public interface JobQueue {

    String enqueueAiGeneration(AiGenerationJob job);

    String enqueueMonteCarlo(String orgId, String modelId, int numSimulations, Long randomSeed);

    String enqueueModelRun(String orgId, String modelRunId);
}
