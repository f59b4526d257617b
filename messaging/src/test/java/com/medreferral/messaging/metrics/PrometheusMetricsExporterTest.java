package com.medreferral.messaging.metrics;

import com.medreferral.messaging.support.TestStores;
import io.micrometer.core.instrument.Metrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrometheusMetricsExporterTest {

    private PrometheusMetricsExporter exporter;

    @BeforeEach
    void setUp() {
        exporter = new PrometheusMetricsExporter(TestStores.config());
    }

    @AfterEach
    void tearDown() {
        exporter.detach();
    }

    @Test
    @DisplayName("Messaging meters are scraped with the node and service tags")
    void testScrapeCarriesCommonTags() {
        MetricsService metrics = new MetricsService(exporter.getRegistry());
        metrics.bindActiveSessions(() -> 3);

        String scrape = exporter.scrape();

        assertTrue(scrape.contains("dm_sessions_active{"), scrape);
        assertTrue(scrape.contains("node_id=\"test-node\""));
        assertTrue(scrape.contains("service=\"" + PrometheusMetricsExporter.SERVICE + "\""));
    }

    @Test
    @DisplayName("The registry joins the global composite until detached")
    void testDetachLeavesGlobalComposite() {
        assertTrue(Metrics.globalRegistry.getRegistries().contains(exporter.getRegistry()));

        exporter.detach();

        assertFalse(Metrics.globalRegistry.getRegistries().contains(exporter.getRegistry()));
    }
}
