package com.medreferral.messaging.metrics;

import com.medreferral.core.metrics.MetricsTags;
import com.medreferral.messaging.config.MessagingConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus registry of a messaging node, served at {@code /metrics}.
 * <p>
 * Messaging meters register here directly and carry the node id and service as common tags. The registry
 * also joins Micrometer's global composite, which is where Reactor Netty records its HTTP server meters,
 * so one scrape returns both. {@link #detach()} leaves the composite again.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
    public static final String SERVICE = "referral-messaging";

    private final PrometheusMeterRegistry registry;

    public PrometheusMetricsExporter(MessagingConfig config) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        registry.config().commonTags(
            MetricsTags.NODE_ID, config.getNodeId(),
            MetricsTags.SERVICE, SERVICE);
        Metrics.addRegistry(registry);
        log.info("Prometheus registry ready for node {} ({} feed)", config.getNodeId(), config.getFeedTransport());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    public String scrape() {
        return registry.scrape();
    }

    /**
     * Removes the registry from the global composite and closes it.
     */
    public void detach() {
        Metrics.removeRegistry(registry);
        registry.close();
    }
}
