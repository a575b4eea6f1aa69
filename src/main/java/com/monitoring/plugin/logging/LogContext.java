package com.monitoring.plugin.logging;

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
 * try (LogContext ctx = LogContext.forCheck("check_disk", LogContext.generateCheckId())) {
 *     log.info("check.finished severity={}", severity);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String PLUGIN_KEY = "plugin";
    public static final String CHECK_ID_KEY = "checkId";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one execution of a plugin check.
     */
    public static LogContext forCheck(String pluginName, String checkId) {
        LogContext ctx = new LogContext();
        ctx.put(PLUGIN_KEY, pluginName);
        ctx.put(CHECK_ID_KEY, checkId);
        return ctx;
    }

    /**
     * Generates a unique check execution ID.
     */
    public static String generateCheckId() {
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
