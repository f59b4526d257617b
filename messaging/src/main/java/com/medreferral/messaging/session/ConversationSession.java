package com.medreferral.messaging.session;

import com.medreferral.core.aggregate.ConversationAggregator;
import com.medreferral.core.error.ErrorCode;
import com.medreferral.core.model.Message;
import com.medreferral.core.msg.ServerEvent;
import com.medreferral.messaging.feed.ChangeFeedListener;
import com.medreferral.messaging.feed.ChangeFeedSubscriber;
import com.medreferral.messaging.read.ReadOutcome;
import com.medreferral.messaging.read.ReadStateTracker;
import com.medreferral.messaging.store.IMessageStore;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One connected client of one user.
 * <p>
 * Owns the user's conversation view for this connection and the feed subscriber that keeps it fresh.
 * Everything the client should see goes through {@link #getOutboundFlux()}; command methods never fail,
 * they report errors as {@code error} events.
 * </p>
 */
public class ConversationSession implements ChangeFeedListener {
    private static final Logger log = LoggerFactory.getLogger(ConversationSession.class);

    @Getter
    private final String sessionId;
    @Getter
    private final String userId;
    @Getter
    private final ConversationAggregator aggregator;

    private final IMessageStore store;
    private final ReadStateTracker readStateTracker;
    private final Sinks.Many<ServerEvent> sink;
    private final ChangeFeedSubscriber subscriber;

    private final AtomicReference<String> openCounterpart = new AtomicReference<>();
    private final AtomicBoolean stale = new AtomicBoolean(true);
    private final AtomicBoolean closed = new AtomicBoolean();

    ConversationSession(String sessionId,
                        String userId,
                        IMessageStore store,
                        ReadStateTracker readStateTracker,
                        Sinks.Many<ServerEvent> sink,
                        SubscriberFactory subscriberFactory) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.store = store;
        this.readStateTracker = readStateTracker;
        this.sink = sink;
        this.aggregator = new ConversationAggregator(userId);
        this.subscriber = subscriberFactory.create(userId, this);
    }

    /**
     * Builds the feed subscriber for a session; lets the session pass itself as listener.
     */
    @FunctionalInterface
    interface SubscriberFactory {
        ChangeFeedSubscriber create(String userId, ChangeFeedListener listener);
    }

    /**
     * Subscribes to the feed and loads the initial view; a {@code conversations} event follows once loaded.
     */
    public void start() {
        log.debug("Starting session {} for user {}", sessionId, userId);
        subscriber.start();
    }

    public Flux<ServerEvent> getOutboundFlux() {
        return sink.asFlux();
    }

    @Nullable
    public String getOpenCounterpart() {
        return openCounterpart.get();
    }

    public boolean isStale() {
        return stale.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Opens the thread with {@code counterpart}: marks its unread messages read and emits {@code thread} then
     * {@code conversations}. Messages arriving for this thread while it stays open are marked read on arrival.
     */
    public Mono<Void> openConversation(String counterpart, @Nullable String requestId) {
        return Mono.defer(() -> {
                ReadStateTracker.requireCounterpart(userId, counterpart);
                openCounterpart.set(counterpart);
                return readStateTracker.open(userId, counterpart, aggregator);
            })
            .doOnNext(outcome -> {
                emit(threadEvent(outcome, requestId));
                emitConversations(requestId);
            })
            .doOnError(err -> emitError(err, requestId))
            .onErrorResume(err -> Mono.empty())
            .then();
    }

    public void closeConversation() {
        String previous = openCounterpart.getAndSet(null);
        log.debug("Session {} closed thread with {}", sessionId, previous);
    }

    /**
     * Appends a message from this session's user. On success the message is applied to the view at once
     * and {@code sent} plus {@code conversations} are emitted; on failure only {@code error}.
     */
    public Mono<Void> send(String recipientId, String body, @Nullable String requestId) {
        return store.append(userId, recipientId, body)
            .doOnNext(message -> {
                aggregator.applyInserted(message);
                emit(ServerEvent.builder()
                    .type(ServerEvent.SENT)
                    .requestId(requestId)
                    .message(message)
                    .ts(System.currentTimeMillis())
                    .build());
                emitConversations(requestId);
            })
            .doOnError(err -> emitError(err, requestId))
            .onErrorResume(err -> Mono.empty())
            .then();
    }

    /**
     * Full rescan of the view. The previous list stays, marked stale, until a fetch succeeds.
     */
    public void refresh() {
        subscriber.reconcile();
    }

    @Override
    public void onInserted(Message message) {
        if (closed.get() || !aggregator.applyInserted(message)) {
            return;
        }
        emit(ServerEvent.builder()
            .type(ServerEvent.MESSAGE)
            .message(message)
            .counterpartId(message.counterpartOf(userId))
            .ts(System.currentTimeMillis())
            .build());
        emitConversations(null);

        if (message.isAddressedTo(userId) && Objects.equals(openCounterpart.get(), message.getSenderId())) {
            readStateTracker.markDelivered(userId, message, aggregator)
                .subscribe(changed -> {
                    if (changed) {
                        emitConversations(null);
                    }
                }, err -> log.warn("Could not mark message {} read for {}: {}",
                    message.getId(), userId, err.getMessage()));
        }
    }

    @Override
    public void onReconciled(List<Message> involving) {
        aggregator.replaceAll(involving);
        stale.set(false);
        emitConversations(null);
    }

    @Override
    public void onStale(Throwable cause) {
        stale.set(true);
        emit(ServerEvent.builder()
            .type(ServerEvent.STALE)
            .stale(true)
            .error(cause.getMessage())
            .errorCode(ErrorCode.of(cause).code())
            .conversations(aggregator.snapshot())
            .ts(System.currentTimeMillis())
            .build());
    }

    /**
     * Stops feed callbacks and completes the outbound stream. Idempotent.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        subscriber.close();
        synchronized (sink) {
            sink.tryEmitComplete();
        }
        log.debug("Session {} closed for user {}", sessionId, userId);
    }

    public void emitPong(@Nullable String requestId) {
        emit(ServerEvent.builder()
            .type(ServerEvent.PONG)
            .requestId(requestId)
            .ts(System.currentTimeMillis())
            .build());
    }

    public void emitError(Throwable err, @Nullable String requestId) {
        ErrorCode code = ErrorCode.of(err);
        if (code == ErrorCode.INTERNAL) {
            log.error("Session {} command failed", sessionId, err);
        } else {
            log.debug("Session {} command rejected: {}", sessionId, err.getMessage());
        }
        emit(ServerEvent.builder()
            .type(ServerEvent.ERROR)
            .requestId(requestId)
            .error(err.getMessage())
            .errorCode(code.code())
            .ts(System.currentTimeMillis())
            .build());
    }

    private void emitConversations(@Nullable String requestId) {
        emit(ServerEvent.builder()
            .type(ServerEvent.CONVERSATIONS)
            .requestId(requestId)
            .stale(stale.get())
            .conversations(aggregator.snapshot())
            .ts(System.currentTimeMillis())
            .build());
    }

    private ServerEvent threadEvent(ReadOutcome outcome, @Nullable String requestId) {
        return ServerEvent.builder()
            .type(ServerEvent.THREAD)
            .requestId(requestId)
            .counterpartId(outcome.getCounterpartId())
            .messages(outcome.getThread())
            .ts(System.currentTimeMillis())
            .build();
    }

    private void emit(ServerEvent event) {
        if (closed.get()) {
            return;
        }
        Sinks.EmitResult result;
        // feed, timer and command threads all emit here
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure()) {
            log.warn("Dropped {} event for session {}: {}", event.getType(), sessionId, result);
        }
    }
}
