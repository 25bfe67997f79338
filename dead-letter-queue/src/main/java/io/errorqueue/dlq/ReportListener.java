package io.errorqueue.dlq;

import java.time.Duration;

/**
 * Observes the outcome of each error report. Used for metrics.
 */
public interface ReportListener {

    ReportListener NOOP = new ReportListener() {};

    default void onPublished(Delivery delivery, Duration elapsed) {}

    default void onFault(FaultKind kind) {}
}
