package com.coach.linkage.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Scoped SLF4J MDC entries for one scan, merge or import. Every entry put through this
 * context is removed on {@link #close()}, so use it with try-with-resources:
 *
 * <pre>
 * try (LogContext ctx = LogContext.forMerge(correlationId, "coach", keeperId, loserId)) {
 *     log.info("merge.completed keeperId={} loserId={}", keeperId, loserId);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Deque<String> keys = new ArrayDeque<>();

    private LogContext(String operation) {
        with("operation", operation);
    }

    public static LogContext forScan(String correlationId, String recordKind) {
        return new LogContext("scan")
                .with("correlationId", correlationId)
                .with("recordKind", recordKind);
    }

    public static LogContext forMerge(String correlationId, String recordKind, String keeperId, String loserId) {
        return new LogContext("merge")
                .with("correlationId", correlationId)
                .with("recordKind", recordKind)
                .with("keeperId", keeperId)
                .with("loserId", loserId);
    }

    /**
     * Context for one spreadsheet import, keyed by the preview's batch id.
     */
    public static LogContext forImport(String batchId) {
        return new LogContext("import").with("batchId", batchId);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        MDC.put(key, value);
        keys.push(key);
        return this;
    }

    @Override
    public void close() {
        while (!keys.isEmpty()) {
            MDC.remove(keys.pop());
        }
    }
}
