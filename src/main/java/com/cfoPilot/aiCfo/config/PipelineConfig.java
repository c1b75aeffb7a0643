package com.cfoPilot.aiCfo.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans for the query pipeline.
 */
@Configuration
public class PipelineConfig {

    /**
     * Pool used for fan-out lookups (classification, connector/transaction probes, grounding probes)
     * and for the in-process AI generation worker.
     */
    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor pipelineExecutor(@Value("${ai-cfo.pipeline.executor-threads:8}") int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "ai-cfo-pipeline-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new MdcAwareExecutor(Executors.newFixedThreadPool(threads, threadFactory));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
