package com.medreferral.messaging.support;

import com.medreferral.messaging.config.MessagingConfig;
import com.medreferral.messaging.feed.IChangeFeed;
import com.medreferral.messaging.metrics.MetricsService;
import com.medreferral.messaging.store.ConnectionProvider;
import com.medreferral.messaging.store.JdbcMessageStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Fresh H2 in-memory stores and configs for tests.
 */
public final class TestStores {
    private TestStores() {
    }

    public static MetricsService metrics() {
        return new MetricsService(new SimpleMeterRegistry());
    }

    /**
     * Store whose JDBC calls run on the calling thread, so feed callbacks happen before append returns.
     */
    public static JdbcMessageStore synchronous(IChangeFeed feed, MetricsService metricsService) {
        return create(feed, metricsService, Schedulers.immediate());
    }

    public static JdbcMessageStore create(IChangeFeed feed, MetricsService metricsService, Scheduler scheduler) {
        return create(newDatabase(), feed, metricsService, scheduler);
    }

    public static JdbcMessageStore create(ConnectionProvider connections, IChangeFeed feed,
                                          MetricsService metricsService, Scheduler scheduler) {
        JdbcMessageStore store = new JdbcMessageStore(connections, feed, metricsService, Clock.systemUTC(), scheduler);
        store.initSchema();
        return store;
    }

    public static ConnectionProvider newDatabase() {
        String url = "jdbc:h2:mem:messages-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
        return ConnectionProvider.driverManager(url, "sa", "");
    }

    public static MessagingConfig config() {
        return MessagingConfig.builder()
            .nodeId("test-node")
            .httpPort(0)
            .feedTransport(MessagingConfig.FEED_LOCAL)
            .redisUrl("")
            .presenceTtlSec(60)
            .authSecret("test-secret")
            .tokenTtl(Duration.ofHours(1))
            .reconnectBase(Duration.ofMillis(100))
            .reconnectMax(Duration.ofSeconds(2))
            .reconnectJitter(Duration.ZERO)
            .perSessionBufferSize(256)
            .pingInterval(10)
            .idleTimeout(60)
            .build();
    }
}
