package com.medreferral.messaging.ws;

import com.medreferral.messaging.auth.IAuthService;
import com.medreferral.messaging.http.ErrorResponses;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Collection;
import java.util.stream.Stream;

/**
 * Authenticates the {@code token} query parameter before upgrading to WebSocket.
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final WebSocketHandler wsHandler;
    private final IAuthService authService;
    private final ErrorResponses errorResponses;

    public WebSocketUpgradeHandler(WebSocketHandler wsHandler, IAuthService authService,
                                   ErrorResponses errorResponses) {
        this.wsHandler = wsHandler;
        this.authService = authService;
        this.errorResponses = errorResponses;
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        // Extract query parameters from HTTP request (before upgrade)
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());

        String token = Stream.ofNullable(decoder.parameters().get("token"))
            .flatMap(Collection::stream).findFirst()
            .orElse(null);

        return authService.authenticate(token)
            .onErrorResume(err -> {
                log.debug("WebSocket upgrade refused: {}", err.getMessage());
                return errorResponses.send(res, err).then(Mono.<String>empty());
            })
            .flatMap(userId -> res.sendWebsocket((inbound, outbound) ->
                wsHandler.handle(inbound, outbound, userId)));
    }
}
