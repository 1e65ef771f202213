package com.contact.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMerge(correlationId, primaryId)) {
 *     log.info("merge.completed primaryId={} removed={}", primaryId, removed);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one incremental sync run.
     */
    public static LogContext forSync(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("syncRunId", runId);
        ctx.put("operation", "sync");
        return ctx;
    }

    public static LogContext forDetection(String correlationId, double threshold) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("threshold", String.valueOf(threshold));
        ctx.put("operation", "detect");
        return ctx;
    }

    public static LogContext forMerge(String correlationId, String primaryContactId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("primaryContactId", primaryContactId != null ? primaryContactId : "auto");
        ctx.put("operation", "merge");
        return ctx;
    }

    public static LogContext forFlag(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "flag");
        return ctx;
    }

    public static String generateCorrelationId() {
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
