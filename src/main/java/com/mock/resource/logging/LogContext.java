package com.mock.resource.logging;

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
 * try (LogContext ctx = LogContext.forDispatch("GET", "/books/1.xml")) {
 *     log.debug("request.dispatched route={}", pattern);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a test scenario.
     */
    public static LogContext forScenario(String scenarioId, String scenarioName) {
        LogContext ctx = new LogContext();
        ctx.put("scenarioId", scenarioId);
        ctx.put("scenario", scenarioName);
        ctx.put("operation", "scenario");
        return ctx;
    }

    /**
     * Creates a log context for a simulated request dispatch.
     */
    public static LogContext forDispatch(String verb, String path) {
        LogContext ctx = new LogContext();
        ctx.put("verb", verb);
        ctx.put("path", path);
        ctx.put("operation", "dispatch");
        return ctx;
    }

    /**
     * Generates a unique scenario ID.
     */
    public static String generateScenarioId() {
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
