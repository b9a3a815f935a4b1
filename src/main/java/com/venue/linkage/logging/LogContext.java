package com.venue.linkage.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forMatchRun(runId)) {
 *     log.info("match.run.completed matched={} total={}", matched, total);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole matching run.
     */
    public static LogContext forMatchRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Creates a log context for one worker chunk of a parallel run.
     */
    public static LogContext forChunk(String runId, int firstProbe, int lastProbe) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "match-chunk");
        ctx.put("probeRange", firstProbe + "-" + lastProbe);
        return ctx;
    }

    /**
     * Creates a log context for loading one source collection.
     */
    public static LogContext forLoad(String source) {
        LogContext ctx = new LogContext();
        ctx.put("source", source);
        ctx.put("operation", "load");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
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
