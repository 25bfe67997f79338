package io.errorqueue.logging;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

import org.slf4j.MDC;

/**
 * Diagnostic context for one error report, kept in the SLF4J MDC.
 *
 * Every log line written while a failed delivery is being redirected carries the
 * report id and the routing key and exchange of the original delivery, so the
 * diagnostic for a broken error path can be matched to the consumer failure that
 * triggered it.
 *
 * Usage:
 * <pre>
 * try (ReportContext ctx = ReportContext.open(routingKey, exchange)) {
 *     log.error("Failed to publish error message"); // carries reportId, errorRoutingKey, errorExchange
 * }
 * </pre>
 */
public class ReportContext implements AutoCloseable {

    public static final String REPORT_ID_KEY = "reportId";
    public static final String ROUTING_KEY_KEY = "errorRoutingKey";
    public static final String EXCHANGE_KEY = "errorExchange";

    private final Map<String, String> previousContext;

    private ReportContext(Map<String, String> previousContext) {
        this.previousContext = previousContext;
    }

    /**
     * Opens a context with a generated report id. Null values are not put in the MDC.
     */
    public static ReportContext open(String routingKey, String exchange) {
        return open(generateId(), routingKey, exchange);
    }

    public static ReportContext open(String reportId, String routingKey, String exchange) {
        Map<String, String> previous = MDC.getCopyOfContextMap();

        ReportContext context = new ReportContext(previous);
        context.with(REPORT_ID_KEY, reportId);
        context.with(ROUTING_KEY_KEY, routingKey);
        context.with(EXCHANGE_KEY, exchange);
        return context;
    }

    /**
     * Gets the current report id, or null outside a report.
     */
    public static String getCurrentReportId() {
        return MDC.get(REPORT_ID_KEY);
    }

    public ReportContext with(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
        return this;
    }

    /**
     * Wraps a Runnable to carry the current report context to another thread.
     */
    public static Runnable wrap(Runnable runnable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                runnable.run();
            } finally {
                restore(previous);
            }
        };
    }

    /**
     * Wraps a Callable to carry the current report context to another thread.
     */
    public static <T> Callable<T> wrap(Callable<T> callable) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return () -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            try {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                return callable.call();
            } finally {
                restore(previous);
            }
        };
    }

    @Override
    public void close() {
        restore(previousContext);
    }

    private static void restore(Map<String, String> previous) {
        if (previous != null) {
            MDC.setContextMap(previous);
        } else {
            MDC.clear();
        }
    }

    private static String generateId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
