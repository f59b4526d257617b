package com.medreferral.messaging.session;

import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Interface for session management (Dependency Inversion Principle).
 * <p>
 * Abstracts session lifecycle and the presence registry. A user may hold several sessions at once.
 * </p>
 */
public interface ISessionManager {
    /**
     * Creates, registers and starts a session for a user.
     *
     * @param userId Authenticated user
     * @return Mono of the started session
     */
    Mono<ConversationSession> createSession(String userId);

    /**
     * Closes and unregisters a session. Unknown ids complete empty.
     *
     * @param sessionId Session identifier
     * @return Mono completing when removed
     */
    Mono<Void> removeSession(String sessionId);

    /**
     * Presence of a user across all nodes.
     */
    Mono<Presence> presence(String userId);

    /**
     * Drains all active sessions (graceful shutdown).
     *
     * @return Mono completing when all sessions drained
     */
    Mono<Void> drainAll();

    Collection<String> getActiveSessionIds();
}
