package com.medreferral.messaging.session;

import com.medreferral.core.msg.ServerEvent;
import com.medreferral.core.util.JitterBackoff;
import com.medreferral.messaging.config.MessagingConfig;
import com.medreferral.messaging.feed.ChangeFeedSubscriber;
import com.medreferral.messaging.feed.IChangeFeed;
import com.medreferral.messaging.metrics.MetricsService;
import com.medreferral.messaging.read.ReadStateTracker;
import com.medreferral.messaging.store.IMessageStore;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.UUID;

/**
 * Wires a {@link ConversationSession} with its outbound sink and feed subscriber.
 */
public class SessionFactory {
    private final IMessageStore store;
    private final IChangeFeed feed;
    private final ReadStateTracker readStateTracker;
    private final JitterBackoff backoff;
    private final Scheduler timer;
    private final MetricsService metricsService;
    private final int bufferSize;

    public SessionFactory(MessagingConfig config,
                          IMessageStore store,
                          IChangeFeed feed,
                          Scheduler timer,
                          MetricsService metricsService) {
        this.store = store;
        this.feed = feed;
        this.readStateTracker = new ReadStateTracker(store);
        this.backoff = new JitterBackoff(config.getReconnectBase(), config.getReconnectMax(),
            config.getReconnectJitter());
        this.timer = timer;
        this.metricsService = metricsService;
        this.bufferSize = config.getPerSessionBufferSize();
    }

    /**
     * Creates a session that is not started yet.
     */
    public ConversationSession createSession(String userId) {
        // Buffers events emitted before the socket subscribes
        Sinks.Many<ServerEvent> sink = Sinks.many().multicast().onBackpressureBuffer(bufferSize, false);

        return new ConversationSession(
            UUID.randomUUID().toString(),
            userId,
            store,
            readStateTracker,
            sink,
            (owner, listener) -> new ChangeFeedSubscriber(owner, feed, store, listener, backoff, timer, metricsService)
        );
    }
}
