package com.medreferral.messaging.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a messaging node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class MessagingConfig {

    public static final String FEED_KAFKA = "kafka";
    public static final String FEED_LOCAL = "local";

    String nodeId;
    int httpPort;

    String jdbcUrl;
    String jdbcUser;
    String jdbcPassword;

    /**
     * {@code kafka} for multi-node deployments, {@code local} for a single node.
     */
    String feedTransport;
    String kafkaBootstrap;

    /**
     * Empty disables the Redis-backed presence registry and profile directory.
     */
    String redisUrl;
    int presenceTtlSec;

    String authSecret;
    Duration tokenTtl;

    Duration reconnectBase;
    Duration reconnectMax;
    Duration reconnectJitter;

    int perSessionBufferSize;
    int pingInterval;
    int idleTimeout;

    public boolean isRedisEnabled() {
        return redisUrl != null && !redisUrl.isBlank();
    }

    public static MessagingConfig fromEnv() {
        return MessagingConfig.builder()
                .nodeId(getEnv("NODE_ID", "messaging-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .jdbcUrl(getEnv("JDBC_URL", "jdbc:h2:mem:messages;DB_CLOSE_DELAY=-1"))
                .jdbcUser(getEnv("JDBC_USER", "sa"))
                .jdbcPassword(getEnv("JDBC_PASSWORD", ""))
                .feedTransport(getEnv("FEED_TRANSPORT", FEED_LOCAL))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .redisUrl(getEnv("REDIS_URL", ""))
                .presenceTtlSec(Integer.parseInt(getEnv("PRESENCE_TTL_SEC", "3600")))
                .authSecret(getEnv("AUTH_SECRET", "change-me"))
                .tokenTtl(Duration.ofSeconds(Long.parseLong(getEnv("TOKEN_TTL_SEC", "86400"))))
                .reconnectBase(Duration.ofMillis(Long.parseLong(getEnv("RECONNECT_BASE_MS", "500"))))
                .reconnectMax(Duration.ofMillis(Long.parseLong(getEnv("RECONNECT_MAX_MS", "30000"))))
                .reconnectJitter(Duration.ofMillis(Long.parseLong(getEnv("RECONNECT_JITTER_MS", "1000"))))
                .perSessionBufferSize(Integer.parseInt(getEnv("PER_SESSION_BUFFER_SIZE", "256")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "10")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "60")))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
