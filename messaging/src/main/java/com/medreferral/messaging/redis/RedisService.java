package com.medreferral.messaging.redis;

import com.medreferral.core.redis.Keys;
import com.medreferral.messaging.config.MessagingConfig;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * Reactive Redis service for presence and profile names.
 * <p>
 * All operations are non-blocking using Lettuce reactive API.
 * </p>
 */
public class RedisService implements IRedisService {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final MessagingConfig config;

    public RedisService(MessagingConfig config) {
        this.config = config;
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    /**
     * Writes the session field with its own TTL (HEXPIRE) and extends the key TTL. Repeated by the session
     * manager while the session lives; fields of a node that stops refreshing lapse on their own.
     */
    @Override
    public Mono<Void> addPresence(String userId, String sessionId, String nodeId) {
        String key = Keys.presence(userId);
        long ttl = config.getPresenceTtlSec();
        return commands.hset(key, sessionId, nodeId)
            .thenMany(commands.hexpire(key, ttl, sessionId))
            .then(commands.expire(key, ttl))
            .then()
            .doOnError(err -> log.error("Failed to record presence for {}", userId, err));
    }

    @Override
    public Mono<Void> removePresence(String userId, String sessionId) {
        return commands.hdel(Keys.presence(userId), sessionId)
            .then()
            .doOnError(err -> log.error("Failed to remove presence for {}", userId, err));
    }

    @Override
    public Mono<Map<String, String>> getPresence(String userId) {
        return commands.hgetall(Keys.presence(userId))
            .collectMap(KeyValue::getKey, KeyValue::getValue)
            .doOnError(err -> log.error("Failed to read presence for {}", userId, err));
    }

    @Override
    public Mono<Map<String, String>> getProfileNames(Collection<String> userIds) {
        return Flux.fromIterable(userIds)
            .distinct()
            .flatMap(userId -> commands.hget(Keys.profile(userId), Keys.PROFILE_NAME_FIELD)
                .map(name -> Map.entry(userId, name)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .doOnError(err -> log.error("Failed to read profile names for {} users", userIds.size(), err));
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
