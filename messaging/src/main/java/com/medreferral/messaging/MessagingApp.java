package com.medreferral.messaging;

import com.medreferral.messaging.auth.TokenAuthService;
import com.medreferral.messaging.config.MessagingConfig;
import com.medreferral.messaging.directory.IProfileLookup;
import com.medreferral.messaging.directory.RedisProfileLookup;
import com.medreferral.messaging.feed.IChangeFeed;
import com.medreferral.messaging.feed.KafkaChangeFeed;
import com.medreferral.messaging.feed.LocalChangeFeed;
import com.medreferral.messaging.http.ApiHandler;
import com.medreferral.messaging.http.ErrorResponses;
import com.medreferral.messaging.http.HttpServer;
import com.medreferral.messaging.metrics.MetricsService;
import com.medreferral.messaging.metrics.PrometheusMetricsExporter;
import com.medreferral.messaging.redis.RedisService;
import com.medreferral.messaging.session.SessionFactory;
import com.medreferral.messaging.session.SessionManager;
import com.medreferral.messaging.store.ConnectionProvider;
import com.medreferral.messaging.store.JdbcMessageStore;
import com.medreferral.messaging.ws.WebSocketHandler;
import com.medreferral.messaging.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Main entry point for a messaging node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve the direct-messaging REST API and WebSockets at /ws/connect (query: token)</li>
 *   <li>Persist messages through JDBC and publish inserts on the change feed</li>
 *   <li>Keep one live conversation view per connected session</li>
 *   <li>Record presence in Redis</li>
 *   <li>Expose /healthz and /metrics endpoints</li>
 * </ul>
 * </p>
 */
public class MessagingApp {
    private static final Logger log = LoggerFactory.getLogger(MessagingApp.class);

    public static void main(String[] args) {
        MessagingConfig config = MessagingConfig.fromEnv();
        MDC.put("nodeId", config.getNodeId());

        log.info("Starting messaging node: {}", config.getNodeId());
        log.info("  JDBC: {}", config.getJdbcUrl());
        log.info("  Feed: {}", config.getFeedTransport());
        log.info("  Redis: {}", config.isRedisEnabled() ? config.getRedisUrl() : "disabled");

        // Setup metrics registry with Prometheus support
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config);
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry());

        IChangeFeed feed = MessagingConfig.FEED_KAFKA.equals(config.getFeedTransport())
            ? new KafkaChangeFeed(config)
            : new LocalChangeFeed();

        JdbcMessageStore store = new JdbcMessageStore(
            ConnectionProvider.driverManager(config.getJdbcUrl(), config.getJdbcUser(), config.getJdbcPassword()),
            feed,
            metricsService
        );
        store.initSchema();

        RedisService redisService = config.isRedisEnabled() ? new RedisService(config) : null;
        IProfileLookup profileLookup = redisService != null
            ? new RedisProfileLookup(redisService)
            : IProfileLookup.unknown();

        SessionManager sessionManager = new SessionManager(
            redisService,
            config,
            new SessionFactory(config, store, feed, Schedulers.parallel(), metricsService),
            metricsService
        );

        // Start the feed consumer (block until initialized)
        feed.start().block();

        TokenAuthService authService = new TokenAuthService(config.getAuthSecret(), config.getTokenTtl());
        ErrorResponses errorResponses = new ErrorResponses(metricsService);

        HttpServer httpServer = new HttpServer(
            config,
            new ApiHandler(authService, store, profileLookup, sessionManager, errorResponses),
            new WebSocketUpgradeHandler(
                new WebSocketHandler(config, sessionManager, profileLookup), authService, errorResponses),
            metricsExporter
        );
        httpServer.start();

        Disposable presenceRefresh = sessionManager.startPresenceRefresh(Schedulers.parallel());

        log.info("Messaging node {} is ready", config.getNodeId());

        handleShutdown(config, sessionManager, feed, httpServer, redisService, metricsExporter, presenceRefresh);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(MessagingConfig config,
                                       SessionManager sessionManager,
                                       IChangeFeed feed,
                                       HttpServer httpServer,
                                       RedisService redisService,
                                       PrometheusMetricsExporter metricsExporter,
                                       Disposable presenceRefresh) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("nodeId", config.getNodeId());

            presenceRefresh.dispose();

            // Stop accepting connections
            httpServer.stop();

            // Close sessions before the feed so subscribers do not see a disconnect
            sessionManager.drainAll().block(Duration.ofSeconds(30));

            feed.stop().block(Duration.ofSeconds(10));

            if (redisService != null) {
                redisService.close();
            }
            metricsExporter.detach();

            log.info("Shutdown complete");
        }));
    }
}
