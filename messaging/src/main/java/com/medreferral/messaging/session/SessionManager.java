package com.medreferral.messaging.session;

import com.medreferral.messaging.config.MessagingConfig;
import com.medreferral.messaging.metrics.MetricsService;
import com.medreferral.messaging.redis.IRedisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the live sessions of this node.
 * <p>
 * Each session is also recorded in the Redis presence hash of its user and re-recorded every third of the
 * presence TTL while it lives. Without Redis, presence is answered from the sessions of this node only.
 * </p>
 */
public class SessionManager implements ISessionManager {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    @Nullable
    private final IRedisService redisService;
    private final MessagingConfig config;
    private final SessionFactory sessionFactory;

    // Active sessions: sessionId -> session
    private final Map<String, ConversationSession> activeSessions = new ConcurrentHashMap<>();

    public SessionManager(@Nullable IRedisService redisService,
                          MessagingConfig config,
                          SessionFactory sessionFactory,
                          MetricsService metricsService) {
        this.redisService = redisService;
        this.config = config;
        this.sessionFactory = sessionFactory;
        metricsService.bindActiveSessions(activeSessions::size);
    }

    @Override
    public Mono<ConversationSession> createSession(String userId) {
        return Mono.defer(() -> {
            ConversationSession session = sessionFactory.createSession(userId);

            // Register locally BEFORE Redis save so feed events are not missed
            activeSessions.put(session.getSessionId(), session);
            session.start();

            if (redisService == null) {
                return Mono.just(session);
            }
            return redisService.addPresence(userId, session.getSessionId(), config.getNodeId())
                .doOnSuccess(v -> log.debug("Presence recorded for user {}, session {}, nodeId={}",
                    userId, session.getSessionId(), config.getNodeId()))
                .doOnError(err -> {
                    // Keep local and Redis state consistent
                    log.error("Failed to record presence for {}, closing session {}", userId,
                        session.getSessionId(), err);
                    activeSessions.remove(session.getSessionId());
                    session.close();
                })
                .thenReturn(session);
        });
    }

    @Override
    public Mono<Void> removeSession(String sessionId) {
        return Mono.defer(() -> {
            ConversationSession session = activeSessions.remove(sessionId);
            if (session == null) {
                return Mono.empty();
            }
            session.close();

            Mono<Void> presence = redisService == null
                ? Mono.empty()
                : redisService.removePresence(session.getUserId(), sessionId);

            return presence.doOnSuccess(v -> log.debug("Session {} removed for user {}",
                sessionId, session.getUserId()));
        });
    }

    @Override
    public Mono<Presence> presence(String userId) {
        if (redisService == null) {
            long local = activeSessions.values().stream()
                .filter(session -> session.getUserId().equals(userId))
                .count();
            return Mono.just(local == 0
                ? Presence.offline(userId)
                : new Presence(userId, true, (int) local, Set.of(config.getNodeId())));
        }
        return redisService.getPresence(userId)
            .map(sessions -> sessions.isEmpty()
                ? Presence.offline(userId)
                : new Presence(userId, true, sessions.size(), new TreeSet<>(sessions.values())));
    }

    /**
     * Starts the periodic presence refresh. Returns a disposed handle when Redis is not configured.
     */
    public Disposable startPresenceRefresh(Scheduler scheduler) {
        if (redisService == null) {
            return Disposables.disposed();
        }
        Duration period = Duration.ofSeconds(Math.max(1, config.getPresenceTtlSec() / 3));
        log.info("Refreshing presence every {} s", period.toSeconds());
        return Flux.interval(period, period, scheduler)
            .onBackpressureDrop()
            .concatMap(tick -> refreshPresence())
            .subscribe();
    }

    Mono<Void> refreshPresence() {
        if (redisService == null) {
            return Mono.empty();
        }
        List<ConversationSession> live = List.copyOf(activeSessions.values());
        return Flux.fromIterable(live)
            // skip sessions removed since the copy, or their field would come back
            .filter(session -> activeSessions.containsKey(session.getSessionId()))
            .flatMap(session -> redisService.addPresence(session.getUserId(), session.getSessionId(),
                    config.getNodeId())
                .onErrorResume(err -> {
                    log.warn("Presence refresh failed for session {}: {}", session.getSessionId(), err.getMessage());
                    return Mono.empty();
                }))
            .then()
            .doOnSuccess(v -> log.debug("Refreshed presence of {} sessions", live.size()));
    }

    @Override
    public Mono<Void> drainAll() {
        log.info("Draining {} active sessions", activeSessions.size());
        return Flux.fromIterable(activeSessions.keySet())
            .flatMap(sessionId -> removeSession(sessionId)
                .onErrorResume(err -> {
                    log.warn("Failed to remove session {} while draining: {}", sessionId, err.getMessage());
                    return Mono.empty();
                }))
            .then();
    }

    @Override
    public Collection<String> getActiveSessionIds() {
        return activeSessions.keySet();
    }
}
