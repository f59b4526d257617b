package com.medreferral.messaging.http;

import com.medreferral.core.aggregate.ConversationAggregator;
import com.medreferral.core.error.ValidationException;
import com.medreferral.core.util.JsonUtils;
import com.medreferral.messaging.auth.IAuthService;
import com.medreferral.messaging.directory.IProfileLookup;
import com.medreferral.messaging.read.ReadStateTracker;
import com.medreferral.messaging.session.ISessionManager;
import com.medreferral.messaging.store.IMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Map;
import java.util.Set;

/**
 * REST endpoints of the messaging API. Every call needs {@code Authorization: Bearer <token>}.
 */
public class ApiHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiHandler.class);

    private static final String BEARER = "Bearer ";

    private final IAuthService authService;
    private final IMessageStore store;
    private final ReadStateTracker readStateTracker;
    private final IProfileLookup profileLookup;
    private final ISessionManager sessionManager;
    private final ErrorResponses errorResponses;

    public ApiHandler(IAuthService authService,
                      IMessageStore store,
                      IProfileLookup profileLookup,
                      ISessionManager sessionManager,
                      ErrorResponses errorResponses) {
        this.authService = authService;
        this.store = store;
        this.readStateTracker = new ReadStateTracker(store);
        this.profileLookup = profileLookup;
        this.sessionManager = sessionManager;
        this.errorResponses = errorResponses;
    }

    /**
     * {@code POST /api/messages} {recipientId, body} → 201 with the stored message.
     */
    public Mono<Void> sendMessage(HttpServerRequest req, HttpServerResponse res) {
        return authenticate(req)
            .flatMap(userId -> readBody(req, SendMessageRequest.class)
                .flatMap(body -> store.append(userId, body.getRecipientId(), body.getBody())))
            .flatMap(message -> {
                log.debug("Message {} sent from {} to {}", message.getId(), message.getSenderId(),
                    message.getRecipientId());
                return ErrorResponses.json(res, 201, message);
            })
            .onErrorResume(err -> errorResponses.send(res, err));
    }

    /**
     * {@code GET /api/conversations} → full rescan, rendered with display names.
     */
    public Mono<Void> listConversations(HttpServerRequest req, HttpServerResponse res) {
        return authenticate(req)
            .flatMap(userId -> store.fetchInvolving(userId)
                .collectList()
                .map(involving -> ConversationAggregator.rescan(userId, involving)))
            .flatMap(profileLookup::views)
            .flatMap(views -> ErrorResponses.json(res, 200, views))
            .onErrorResume(err -> errorResponses.send(res, err));
    }

    /**
     * {@code GET /api/conversations/{counterpartId}/messages} → opens the thread, marking it read.
     */
    public Mono<Void> openThread(HttpServerRequest req, HttpServerResponse res) {
        String counterpart = req.param("counterpartId");
        return authenticate(req)
            .flatMap(userId -> readStateTracker.open(userId, counterpart))
            .flatMap(outcome -> ErrorResponses.json(res, 200, Map.of(
                "counterpartId", outcome.getCounterpartId(),
                "messages", outcome.getThread(),
                "newlyRead", outcome.getNewlyRead())))
            .onErrorResume(err -> errorResponses.send(res, err));
    }

    /**
     * {@code POST /api/messages/read} {ids} → {updated}.
     */
    public Mono<Void> markRead(HttpServerRequest req, HttpServerResponse res) {
        return authenticate(req)
            .flatMap(userId -> readBody(req, MarkReadRequest.class)
                .flatMap(body -> store.markRead(userId, body.getIds() != null ? body.getIds() : Set.of())))
            .flatMap(updated -> ErrorResponses.json(res, 200, Map.of("updated", updated)))
            .onErrorResume(err -> errorResponses.send(res, err));
    }

    /**
     * {@code GET /api/presence/{userId}} → {userId, online, sessions, nodes}.
     */
    public Mono<Void> presence(HttpServerRequest req, HttpServerResponse res) {
        String userId = req.param("userId");
        return authenticate(req)
            .flatMap(caller -> sessionManager.presence(userId))
            .flatMap(presence -> ErrorResponses.json(res, 200, presence))
            .onErrorResume(err -> errorResponses.send(res, err));
    }

    private Mono<String> authenticate(HttpServerRequest req) {
        String header = req.requestHeaders().get("Authorization");
        String token = header != null && header.startsWith(BEARER) ? header.substring(BEARER.length()).trim() : null;
        return authService.authenticate(token)
            .doOnNext(userId -> MDC.put("userId", userId));
    }

    private static <T> Mono<T> readBody(HttpServerRequest req, Class<T> type) {
        return req.receive()
            .aggregate()
            .asString()
            .switchIfEmpty(Mono.error(new ValidationException("Request body is required")))
            .map(json -> JsonUtils.readValue(json, type));
    }
}
