package com.medreferral.messaging.store;

import com.google.common.util.concurrent.Striped;
import com.medreferral.core.error.AuthorizationException;
import com.medreferral.core.error.TransientException;
import com.medreferral.core.error.ValidationException;
import com.medreferral.core.model.Message;
import com.medreferral.core.model.PairKey;
import com.medreferral.messaging.feed.IChangeFeed;
import com.medreferral.messaging.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;

/**
 * Relational message store over plain JDBC.
 * <p>
 * <b>Ordering:</b> createdAt comes from a {@link MonotonicClock}, so every append gets a timestamp strictly
 * greater than any earlier one from this store. Timestamp assignment, insert and feed submission for one
 * pair happen under that pair's lock, so the feed sees a pair's messages in creation order.
 * </p>
 * <p>
 * <b>Blocking:</b> JDBC calls run on the supplied scheduler (bounded-elastic by default).
 * {@link SQLException}s surface as {@link TransientException}.
 * </p>
 */
public class JdbcMessageStore implements IMessageStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcMessageStore.class);

    public static final int MAX_BODY_LENGTH = 4000;
    public static final int MAX_USER_ID_LENGTH = 64;
    private static final String SCHEMA_RESOURCE = "db/schema.sql";
    private static final int PAIR_LOCK_STRIPES = 64;

    private static final String COLUMNS = "id, sender_id, recipient_id, body, is_read, created_at";

    private final ConnectionProvider connections;
    private final IChangeFeed feed;
    private final MetricsService metricsService;
    private final MonotonicClock clock;
    private final Scheduler scheduler;
    private final Striped<Lock> pairLocks = Striped.lock(PAIR_LOCK_STRIPES);

    public JdbcMessageStore(ConnectionProvider connections, IChangeFeed feed, MetricsService metricsService) {
        this(connections, feed, metricsService, Clock.systemUTC(), Schedulers.boundedElastic());
    }

    public JdbcMessageStore(ConnectionProvider connections, IChangeFeed feed, MetricsService metricsService,
                            Clock clock, Scheduler scheduler) {
        this.connections = connections;
        this.feed = feed;
        this.metricsService = metricsService;
        this.clock = new MonotonicClock(clock);
        this.scheduler = scheduler;
    }

    /**
     * Applies {@code db/schema.sql} (idempotent) and seeds the clock with the newest stored timestamp so
     * createdAt keeps increasing across restarts.
     */
    public void initSchema() {
        String script = loadSchemaScript();
        try (Connection connection = connections.getConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) {
                    statement.execute(sql.trim());
                }
            }
            try (ResultSet rs = statement.executeQuery("SELECT MAX(created_at) FROM messages")) {
                if (rs.next()) {
                    OffsetDateTime newest = rs.getObject(1, OffsetDateTime.class);
                    if (newest != null) {
                        clock.advanceTo(newest.toInstant());
                    }
                }
            }
            log.info("Message schema ready");
        } catch (SQLException e) {
            throw new TransientException("Failed to initialize message schema", e);
        }
    }

    private static String loadSchemaScript() {
        try (InputStream in = JdbcMessageStore.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public Mono<Message> append(String senderId, String recipientId, String body) {
        String trimmed;
        try {
            trimmed = validateAppend(senderId, recipientId, body);
        } catch (ValidationException e) {
            metricsService.recordSendRejected();
            log.debug("Rejected message from {} to {}: {}", senderId, recipientId, e.getMessage());
            return Mono.error(e);
        }

        long startNanos = System.nanoTime();
        return Mono.fromCallable(() -> insertAndSubmit(senderId, recipientId, trimmed))
            .subscribeOn(scheduler)
            .doOnError(err -> {
                metricsService.recordSendFailed();
                log.error("Failed to append message from {} to {}", senderId, recipientId, err);
            })
            .flatMap(stored -> Mono.fromFuture(stored.publication())
                .onErrorResume(err -> {
                    // The row is durable; sessions catch up on their next reconciliation fetch
                    metricsService.recordPublishFailure(feed.transport());
                    log.warn("Message {} stored but not published on {} feed: {}",
                        stored.message().getId(), feed.transport(), err.getMessage());
                    return Mono.empty();
                })
                .thenReturn(stored.message()))
            .doOnNext(message -> {
                metricsService.recordSendOk(startNanos);
                log.debug("Appended message {} from {} to {} at {}",
                    message.getId(), senderId, recipientId, message.getCreatedAt());
            });
    }

    static String validateAppend(String senderId, String recipientId, String body) {
        requireUserId(senderId, "senderId");
        requireUserId(recipientId, "recipientId");
        if (senderId.equals(recipientId)) {
            throw new ValidationException("Cannot send a message to yourself");
        }
        // trim() also strips control characters, so check what is left afterwards
        String trimmed = body == null ? "" : body.trim();
        if (trimmed.isBlank()) {
            throw new ValidationException("Message body must not be empty");
        }
        if (trimmed.length() > MAX_BODY_LENGTH) {
            throw new ValidationException("Message body exceeds " + MAX_BODY_LENGTH + " characters");
        }
        return trimmed;
    }

    private static void requireUserId(String userId, String field) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
        if (userId.length() > MAX_USER_ID_LENGTH) {
            throw new ValidationException(field + " exceeds " + MAX_USER_ID_LENGTH + " characters");
        }
    }

    private StoredMessage insertAndSubmit(String senderId, String recipientId, String body) throws SQLException {
        Lock lock = pairLocks.get(PairKey.of(senderId, recipientId));
        lock.lock();
        try {
            Message message = Message.builder()
                .id(UUID.randomUUID().toString())
                .senderId(senderId)
                .recipientId(recipientId)
                .body(body)
                .createdAt(clock.next())
                .read(false)
                .build();

            try (Connection connection = connections.getConnection();
                 PreparedStatement ps = connection.prepareStatement(
                     "INSERT INTO messages (" + COLUMNS + ") VALUES (?, ?, ?, ?, FALSE, ?)")) {
                ps.setString(1, message.getId());
                ps.setString(2, message.getSenderId());
                ps.setString(3, message.getRecipientId());
                ps.setString(4, message.getBody());
                ps.setObject(5, OffsetDateTime.ofInstant(message.getCreatedAt(), ZoneOffset.UTC));
                ps.executeUpdate();
            }

            // Subscribing here, under the pair lock, fixes the pair's submission order on the feed
            CompletableFuture<Void> publication = feed.publish(message).toFuture();
            return new StoredMessage(message, publication);
        } catch (SQLException e) {
            throw new TransientException("Failed to store message", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Flux<Message> fetchThread(String requesterId, String userA, String userB) {
        if (requesterId == null || (!requesterId.equals(userA) && !requesterId.equals(userB))) {
            return Flux.error(new AuthorizationException(
                "User " + requesterId + " is not a participant of the thread " + userA + "/" + userB));
        }
        return query(
            "SELECT " + COLUMNS + " FROM messages"
                + " WHERE (sender_id = ? AND recipient_id = ?) OR (sender_id = ? AND recipient_id = ?)"
                + " ORDER BY created_at ASC, id ASC",
            userA, userB, userB, userA);
    }

    @Override
    public Flux<Message> fetchInvolving(String userId) {
        return query(
            "SELECT " + COLUMNS + " FROM messages"
                + " WHERE sender_id = ? OR recipient_id = ?"
                + " ORDER BY created_at DESC, id DESC",
            userId, userId);
    }

    private Flux<Message> query(String sql, String... params) {
        return Mono.fromCallable(() -> {
                try (Connection connection = connections.getConnection();
                     PreparedStatement ps = connection.prepareStatement(sql)) {
                    for (int i = 0; i < params.length; i++) {
                        ps.setString(i + 1, params[i]);
                    }
                    List<Message> result = new ArrayList<>();
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            result.add(mapRow(rs));
                        }
                    }
                    return result;
                } catch (SQLException e) {
                    throw new TransientException("Failed to fetch messages", e);
                }
            })
            .subscribeOn(scheduler)
            .flatMapIterable(list -> list);
    }

    @Override
    public Mono<Integer> markRead(String requesterId, Set<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Mono.just(0);
        }
        List<String> batch = List.copyOf(ids);
        return Mono.fromCallable(() -> markReadInTransaction(requesterId, batch))
            .subscribeOn(scheduler)
            .doOnNext(updated -> {
                metricsService.recordRead(updated);
                log.debug("User {} marked {} of {} messages read", requesterId, updated, batch.size());
            });
    }

    private int markReadInTransaction(String requesterId, List<String> ids) {
        String placeholders = String.join(", ", Collections.nCopies(ids.size(), "?"));
        try (Connection connection = connections.getConnection()) {
            connection.setAutoCommit(false);
            try {
                Map<String, String> recipients = new HashMap<>();
                try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT id, recipient_id FROM messages WHERE id IN (" + placeholders + ")")) {
                    bindAll(ps, 1, ids);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            recipients.put(rs.getString("id"), rs.getString("recipient_id"));
                        }
                    }
                }

                for (String id : ids) {
                    if (!requesterId.equals(recipients.get(id))) {
                        throw new AuthorizationException(
                            "User " + requesterId + " cannot mark message " + id + " as read");
                    }
                }

                int updated;
                try (PreparedStatement ps = connection.prepareStatement(
                    "UPDATE messages SET is_read = TRUE"
                        + " WHERE recipient_id = ? AND is_read = FALSE AND id IN (" + placeholders + ")")) {
                    ps.setString(1, requesterId);
                    bindAll(ps, 2, ids);
                    updated = ps.executeUpdate();
                }
                connection.commit();
                return updated;
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TransientException("Failed to mark messages read", e);
        }
    }

    private static void bindAll(PreparedStatement ps, int firstIndex, List<String> values) throws SQLException {
        for (int i = 0; i < values.size(); i++) {
            ps.setString(firstIndex + i, values.get(i));
        }
    }

    private static Message mapRow(ResultSet rs) throws SQLException {
        Instant createdAt = rs.getObject("created_at", OffsetDateTime.class).toInstant();
        return Message.builder()
            .id(rs.getString("id"))
            .senderId(rs.getString("sender_id"))
            .recipientId(rs.getString("recipient_id"))
            .body(rs.getString("body"))
            .read(rs.getBoolean("is_read"))
            .createdAt(createdAt)
            .build();
    }

    private record StoredMessage(Message message, CompletableFuture<Void> publication) {
    }
}
