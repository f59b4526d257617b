package com.medreferral.messaging.ws;

import com.medreferral.core.error.ValidationException;
import com.medreferral.core.msg.ClientCommand;
import com.medreferral.core.msg.ServerEvent;
import com.medreferral.core.util.JsonUtils;
import com.medreferral.messaging.config.MessagingConfig;
import com.medreferral.messaging.directory.IProfileLookup;
import com.medreferral.messaging.session.ConversationSession;
import com.medreferral.messaging.session.ISessionManager;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket handler for client connections.
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>welcome: {sessionId, userId}</li>
 *   <li>conversations: {views, stale}</li>
 *   <li>thread: {counterpartId, messages}</li>
 *   <li>message: {message, counterpartId}</li>
 *   <li>sent: {message}</li>
 *   <li>stale: {views, error}</li>
 *   <li>error: {error, errorCode}</li>
 *   <li>pong</li>
 * </ul>
 * </p>
 * <p>
 * Protocol (client → server): see {@link ClientCommand}.
 * </p>
 */
public class WebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

    private final MessagingConfig config;
    private final ISessionManager sessionManager;
    private final IProfileLookup profileLookup;

    public WebSocketHandler(MessagingConfig config, ISessionManager sessionManager, IProfileLookup profileLookup) {
        this.config = config;
        this.sessionManager = sessionManager;
        this.profileLookup = profileLookup;
    }

    /**
     * Handles WebSocket connection lifecycle for an authenticated user.
     *
     * @param inbound  WebSocket inbound
     * @param outbound WebSocket outbound
     * @param userId   Authenticated user
     * @return Publisher for the connection
     */
    public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound, String userId) {
        MDC.put("userId", userId);
        log.debug("WebSocket handshake for user {}", userId);

        return sessionManager.createSession(userId)
            .flatMap(session -> {
                MDC.put("sessionId", session.getSessionId());
                handleConnectionStateUpdates(inbound, outbound, session);

                return Mono.when(
                    outbound.sendString(outboundMessages(session)),
                    handleInboundMessages(inbound, session)
                );
            })
            .onErrorResume(err -> {
                log.error("WebSocket error for user {}", userId, err);
                return outbound.sendClose();
            });
    }

    private void handleConnectionStateUpdates(WebsocketInbound inbound, WebsocketOutbound outbound,
                                              ConversationSession session) {
        inbound.withConnection(connection -> {
            long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
            long pingTimeoutInMillis = config.getPingInterval() * 1000L;

            connection.onWriteIdle(pingTimeoutInMillis, () -> connection.outbound().sendObject(
                    Mono.just(new PingWebSocketFrame())
                ).then().subscribe())
                .onReadIdle(idleTimeoutInMillis, () -> outbound.sendClose().subscribe())
                .onDispose(() -> {
                    log.debug("WebSocket disposed for session {}, removing", session.getSessionId());
                    sessionManager.removeSession(session.getSessionId()).subscribe();
                });
        });
    }

    private Flux<String> outboundMessages(ConversationSession session) {
        return Flux.concat(
            Mono.just(welcome(session)),
            session.getOutboundFlux().concatMap(this::render)
        ).map(JsonUtils::writeValueAsString);
    }

    /**
     * Attaches display names to events carrying a conversation list.
     */
    Mono<ServerEvent> render(ServerEvent event) {
        if (event.getConversations() == null) {
            return Mono.just(event);
        }
        return profileLookup.views(event.getConversations())
            .map(views -> event.toBuilder().views(views).build());
    }

    private Mono<Void> handleInboundMessages(WebsocketInbound inbound, ConversationSession session) {
        return inbound.aggregateFrames()
            .receive()
            .asString()
            .onBackpressureBuffer(config.getPerSessionBufferSize())
            .concatMap(json -> handleCommand(session, json)
                .onErrorResume(err -> {
                    session.emitError(err, null);
                    return Mono.empty();
                }))
            .doOnError(err -> {
                // AbortedException is expected on close
                if (!(err instanceof AbortedException)) {
                    log.error("Fatal error in inbound stream for session {}", session.getSessionId(), err);
                }
            })
            .onErrorResume(err -> Mono.empty())
            .then();
    }

    Mono<Void> handleCommand(ConversationSession session, String json) {
        return Mono.defer(() -> {
            ClientCommand command = JsonUtils.readValue(json, ClientCommand.class);
            String type = command.getType();
            if (type == null) {
                return Mono.error(new ValidationException("Command type is required"));
            }
            log.debug("Session {} command {}", session.getSessionId(), type);

            switch (type) {
                case ClientCommand.OPEN -> {
                    return session.openConversation(command.getCounterpartId(), command.getRequestId());
                }
                case ClientCommand.CLOSE -> session.closeConversation();
                case ClientCommand.SEND -> {
                    return session.send(command.getRecipientId(), command.getBody(), command.getRequestId());
                }
                case ClientCommand.REFRESH -> session.refresh();
                case ClientCommand.PING -> session.emitPong(command.getRequestId());
                default -> {
                    return Mono.error(new ValidationException("Unknown command type '" + type + "'"));
                }
            }
            return Mono.empty();
        });
    }

    private ServerEvent welcome(ConversationSession session) {
        return ServerEvent.builder()
            .type(ServerEvent.WELCOME)
            .sessionId(session.getSessionId())
            .userId(session.getUserId())
            .ts(System.currentTimeMillis())
            .build();
    }
}
