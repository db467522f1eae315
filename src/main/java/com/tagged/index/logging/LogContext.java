package com.tagged.index.logging;

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
 * try (LogContext ctx = LogContext.forBuild(buildId, root.toString())) {
 *     log.info("build.started root={}", root);
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a complete graph build.
     */
    public static LogContext forBuild(String buildId, String root) {
        LogContext ctx = new LogContext();
        ctx.put("buildId", buildId);
        ctx.put("root", root);
        ctx.put("operation", "build");
        return ctx;
    }

    /**
     * Generates a unique build ID.
     */
    public static String generateBuildId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds or replaces a key-value pair in this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!keys.contains(key)) {
            keys.add(key);
        }
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
