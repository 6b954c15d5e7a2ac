package com.storage.manager.logging;

import com.storage.manager.core.model.RegistrationKey;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId, key)) {
 *     log.info("cleanup.completed removed={}", removed);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one cleanup run on a registration.
     */
    public static LogContext forRun(String runId, RegistrationKey key) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("volume", key.volumeName());
        ctx.put("path", key.path());
        ctx.put("operation", "cleanup");
        return ctx;
    }

    /**
     * Context for one discovery sweep.
     */
    public static LogContext forSweep(String sweepId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", sweepId);
        ctx.put("operation", "discovery");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
