package com.cfoPilot.aiCfo.config;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;

/**
 * Executor wrapper that carries the caller's MDC (requestId, orgId) into pool threads,
 * so probe and worker log lines stay correlated with the request that spawned them.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        });
    }

    public void shutdown() {
        delegate.shutdownNow();
    }
}
