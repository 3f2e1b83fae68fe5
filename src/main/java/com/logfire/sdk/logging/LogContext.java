package com.logfire.sdk.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for the SDK's own log lines.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forExport(batchId, batch.size())) {
 *     log.warn("export.fallback batchSize={} path={}", batch.size(), path);
 * } // MDC entries are cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for the export of one span batch.
     */
    public static LogContext forExport(String exportBatchId, int batchSize) {
        LogContext ctx = new LogContext();
        ctx.put("exportBatchId", exportBatchId);
        ctx.put("batchSize", Integer.toString(batchSize));
        ctx.put("operation", "export");
        return ctx;
    }

    /**
     * Creates a log context for a processor shutdown.
     */
    public static LogContext forShutdown() {
        LogContext ctx = new LogContext();
        ctx.put("operation", "shutdown");
        return ctx;
    }

    /**
     * Generates a unique batch ID.
     */
    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
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
