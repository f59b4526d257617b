package com.medreferral.messaging.metrics;

import com.medreferral.core.metrics.MetricsNames;
import com.medreferral.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralized metrics for a messaging node.
 */
public class MetricsService {

    private final MeterRegistry registry;

    private final Counter sendOk;
    private final Counter sendRejected;
    private final Counter sendFailed;
    private final Counter readTotal;
    private final Counter feedDelivered;
    private final Counter feedDisconnects;
    private final Counter reconcileOk;
    private final Counter reconcileFailed;

    private final Timer sendLatency;

    private final Map<String, Counter> publishFailures = new ConcurrentHashMap<>();
    private final Map<String, Counter> apiErrors = new ConcurrentHashMap<>();

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        sendOk = Counter.builder(MetricsNames.SEND_TOTAL)
            .tag(MetricsTags.OUTCOME, "ok")
            .description("Messages appended to the store")
            .register(registry);

        sendRejected = Counter.builder(MetricsNames.SEND_TOTAL)
            .tag(MetricsTags.OUTCOME, "rejected")
            .description("Appends rejected by validation")
            .register(registry);

        sendFailed = Counter.builder(MetricsNames.SEND_TOTAL)
            .tag(MetricsTags.OUTCOME, "failed")
            .description("Appends that failed in storage")
            .register(registry);

        readTotal = Counter.builder(MetricsNames.READ_TOTAL)
            .description("Messages transitioned from unread to read")
            .register(registry);

        feedDelivered = Counter.builder(MetricsNames.FEED_DELIVERED)
            .description("Insert events delivered to sessions")
            .register(registry);

        feedDisconnects = Counter.builder(MetricsNames.FEED_DISCONNECTS)
            .description("Feed disconnects observed by session subscribers")
            .register(registry);

        reconcileOk = Counter.builder(MetricsNames.FEED_RECONCILE)
            .tag(MetricsTags.OUTCOME, "ok")
            .register(registry);

        reconcileFailed = Counter.builder(MetricsNames.FEED_RECONCILE)
            .tag(MetricsTags.OUTCOME, "failed")
            .register(registry);

        sendLatency = Timer.builder(MetricsNames.SEND_LATENCY)
            .description("Append latency including feed publication")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(5),
                Duration.ofMillis(20),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500)
            )
            .register(registry);
    }

    /**
     * Registers the active-sessions gauge against a live size supplier.
     */
    public void bindActiveSessions(Supplier<Number> activeSessions) {
        Gauge.builder(MetricsNames.ACTIVE_SESSIONS, activeSessions)
            .description("Open client sessions on this node")
            .register(registry);
    }

    public void recordSendOk(long startNanos) {
        sendOk.increment();
        sendLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordSendRejected() {
        sendRejected.increment();
    }

    public void recordSendFailed() {
        sendFailed.increment();
    }

    public void recordRead(int count) {
        readTotal.increment(count);
    }

    public void recordFeedDelivered() {
        feedDelivered.increment();
    }

    public void recordFeedDisconnect() {
        feedDisconnects.increment();
    }

    public void recordReconcile(boolean success) {
        (success ? reconcileOk : reconcileFailed).increment();
    }

    public void recordPublishFailure(String transport) {
        publishFailures.computeIfAbsent(transport, t -> Counter.builder(MetricsNames.FEED_PUBLISH_FAILURES)
                .tag(MetricsTags.TRANSPORT, t)
                .description("Feed publications that failed after the row was stored")
                .register(registry))
            .increment();
    }

    public void recordApiError(String reason) {
        apiErrors.computeIfAbsent(reason, r -> Counter.builder(MetricsNames.API_ERRORS)
                .tag(MetricsTags.REASON, r)
                .register(registry))
            .increment();
    }
}
