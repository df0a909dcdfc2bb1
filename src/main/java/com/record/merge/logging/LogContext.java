package com.record.merge.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMerge(correlationId, "ACCOUNT", duplicateId, masterId)) {
 *     log.info("merge.completed duplicateId={} masterId={}", duplicateId, masterId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forMerge(String correlationId, String recordType, String duplicateId, String masterId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("recordType", recordType);
        ctx.put("duplicateId", duplicateId);
        ctx.put("masterId", masterId);
        ctx.put("operation", "merge");
        return ctx;
    }

    public static LogContext forPreview(String correlationId, String recordType, String duplicateId, String masterId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("recordType", recordType);
        ctx.put("duplicateId", duplicateId);
        ctx.put("masterId", masterId);
        ctx.put("operation", "preview");
        return ctx;
    }

    public static String generateCorrelationId() {
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
