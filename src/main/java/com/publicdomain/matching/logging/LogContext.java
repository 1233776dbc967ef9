package com.publicdomain.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forBatch(runId, batchId)) {
 *     log.info("batch.completed batchId={} records={}", batchId, count);
 * }
 * </pre>
 *
 * <p>MDC is thread-local: a context opened on the orchestrator thread is not visible
 * to workers, which open their own.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "run");
        return ctx;
    }

    public static LogContext forBatch(String runId, int batchId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("batchId", Integer.toString(batchId));
        ctx.put("operation", "batch");
        return ctx;
    }

    public static LogContext forWorker(String workerId) {
        LogContext ctx = new LogContext();
        ctx.put("workerId", workerId);
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
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
