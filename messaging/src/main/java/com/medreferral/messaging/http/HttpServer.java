package com.medreferral.messaging.http;

import com.medreferral.messaging.config.MessagingConfig;
import com.medreferral.messaging.metrics.PrometheusMetricsExporter;
import com.medreferral.messaging.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, the REST API and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final MessagingConfig config;
    private final ApiHandler apiHandler;
    private final WebSocketUpgradeHandler upgradeHandler;
    private final PrometheusMetricsExporter metricsExporter;
    private DisposableServer server;

    /**
     * Starts the HTTP server.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", PrometheusMetricsExporter.CONTENT_TYPE)
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .post("/api/messages/read", apiHandler::markRead)
                .post("/api/messages", apiHandler::sendMessage)
                .get("/api/conversations/{counterpartId}/messages", apiHandler::openThread)
                .get("/api/conversations", apiHandler::listConversations)
                .get("/api/presence/{userId}", apiHandler::presence)
                .get("/ws/connect", upgradeHandler::handle)
            )
            .bindNow(Duration.ofSeconds(45));

        log.info("HTTP server started on port {}", server.port());
        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
