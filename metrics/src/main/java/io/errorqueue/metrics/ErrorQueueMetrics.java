package io.errorqueue.metrics;

import java.time.Duration;
import java.util.Locale;

import io.errorqueue.dlq.Delivery;
import io.errorqueue.dlq.FaultKind;
import io.errorqueue.dlq.ReportListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer metrics for the error reporter.
 *
 * Provides the following metrics:
 * - error_queue_published_total: Envelopes written to the error queue, by source exchange
 * - error_queue_faults_total: Reports that could not be written, by fault kind
 * - error_queue_publish_duration: Time to connect, declare and publish one report
 */
public class ErrorQueueMetrics implements ReportListener {

    private static final String METRIC_PREFIX = "error_queue";
    static final String DEFAULT_EXCHANGE_TAG = "(default)";

    private final MeterRegistry registry;
    private final Tags baseTags;
    private final Timer publishTimer;

    public ErrorQueueMetrics(MeterRegistry registry) {
        this(registry, Tags.empty());
    }

    public ErrorQueueMetrics(MeterRegistry registry, String reporterName) {
        this(registry, Tags.of("reporter_name", reporterName));
    }

    public ErrorQueueMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;

        this.publishTimer = Timer.builder(METRIC_PREFIX + "_publish_duration")
                .description("Time to write a failed delivery to the error queue")
                .tags(baseTags)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        // Pre-register so dashboards show zero instead of no data
        for (FaultKind kind : FaultKind.values()) {
            faultCounter(kind);
        }
    }

    @Override
    public void onPublished(Delivery delivery, Duration elapsed) {
        String exchange = delivery.getExchange();
        if (exchange == null || exchange.isEmpty()) {
            exchange = DEFAULT_EXCHANGE_TAG;
        }
        Counter.builder(METRIC_PREFIX + "_published_total")
                .description("Failed deliveries written to the error queue")
                .tags(baseTags.and("source_exchange", exchange))
                .register(registry)
                .increment();
        publishTimer.record(elapsed);
    }

    @Override
    public void onFault(FaultKind kind) {
        faultCounter(kind).increment();
    }

    /**
     * Total envelopes published, across all source exchanges.
     */
    public double getPublishedCount() {
        return registry.find(METRIC_PREFIX + "_published_total")
                .tags(baseTags)
                .counters()
                .stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    public double getFaultCount(FaultKind kind) {
        return faultCounter(kind).count();
    }

    private Counter faultCounter(FaultKind kind) {
        return Counter.builder(METRIC_PREFIX + "_faults_total")
                .description("Error reports dropped because the broker or serializer failed")
                .tags(baseTags.and("fault_kind", kind.name().toLowerCase(Locale.ROOT)))
                .register(registry);
    }
}
