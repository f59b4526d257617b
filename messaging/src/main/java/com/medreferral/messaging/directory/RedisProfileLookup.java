package com.medreferral.messaging.directory;

import com.medreferral.messaging.redis.IRedisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;

/**
 * Reads {@code profile:{userId}} hashes. A directory outage degrades to unknown names.
 */
public class RedisProfileLookup implements IProfileLookup {
    private static final Logger log = LoggerFactory.getLogger(RedisProfileLookup.class);

    private final IRedisService redisService;

    public RedisProfileLookup(IRedisService redisService) {
        this.redisService = redisService;
    }

    @Override
    public Mono<Map<String, String>> displayNames(Collection<String> userIds) {
        return redisService.getProfileNames(userIds)
            .onErrorResume(err -> {
                log.warn("Profile lookup failed, rendering unknown names: {}", err.getMessage());
                return Mono.just(Map.of());
            });
    }
}
