package com.lyshra.open.flowsync.core.engine.sync;

import com.lyshra.open.flowsync.core.engine.config.FlowSyncConfig;
import com.lyshra.open.flowsync.integration.exception.WorkflowSourceReadException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

public final class SyncRetryFactory {

    private SyncRetryFactory() {
    }

    public static Retry buildRetry(FlowSyncConfig config) {
        if (config.getMaxRetries() <= 0) {
            return Retry.max(0);
        }
        return Retry
                .backoff(config.getMaxRetries(), config.getInitialRetryBackoff())
                .maxBackoff(config.getMaxRetryBackoff())
                .jitter(0.2)
                .filter(SyncRetryFactory::isTransient)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    /**
     * Network and timeout failures talking to a runtime or repository. Storage and
     * validation failures are never transient.
     */
    public static boolean isTransient(Throwable error) {
        return error instanceof WorkflowSourceReadException
                || error instanceof TimeoutException
                || error instanceof IOException
                || error instanceof UncheckedIOException;
    }
}
