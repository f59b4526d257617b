package com.medreferral.messaging.redis;

import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * Interface for Redis operations (Dependency Inversion Principle).
 * <p>
 * Enables testing with stub implementations.
 * </p>
 */
public interface IRedisService {
    /**
     * Records an open session of a user on a node, or refreshes it, with a TTL on the session entry.
     */
    Mono<Void> addPresence(String userId, String sessionId, String nodeId);

    /**
     * Removes one session from a user's presence.
     */
    Mono<Void> removePresence(String userId, String sessionId);

    /**
     * Open sessions of a user: sessionId → nodeId. Empty map when offline.
     */
    Mono<Map<String, String>> getPresence(String userId);

    /**
     * Display names of the given users. Users without a profile are absent from the map.
     */
    Mono<Map<String, String>> getProfileNames(Collection<String> userIds);

    /**
     * Closes Redis connection.
     */
    void close();
}
