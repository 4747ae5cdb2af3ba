package com.memory.graph.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forExtraction(entryId, "ollama/gpt-oss:20b")) {
 *     log.info("extraction.succeeded entities={}", count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final List<String> previousValues = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a background extraction run of one entry.
     */
    public static LogContext forExtraction(String entryId, String provider) {
        LogContext ctx = new LogContext();
        ctx.put("entryId", entryId);
        ctx.put("provider", provider);
        ctx.put("operation", "extract");
        return ctx;
    }

    /**
     * Context for a synchronous ingestion request.
     */
    public static LogContext forIngestion(String entryId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("entryId", entryId);
        ctx.put("operation", "ingest");
        return ctx;
    }

    /**
     * Context for applying a mutation plan to the graph.
     */
    public static LogContext forCommit(String entryId) {
        LogContext ctx = new LogContext();
        ctx.put("entryId", entryId);
        ctx.put("operation", "commit");
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
        previousValues.add(MDC.get(key));
        MDC.put(key, value);
    }

    /**
     * Removes the keys added by this context. Values set by an enclosing context are restored.
     */
    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String previous = previousValues.get(i);
            if (previous != null) {
                MDC.put(keys.get(i), previous);
            } else {
                MDC.remove(keys.get(i));
            }
        }
        keys.clear();
        previousValues.clear();
    }
}
