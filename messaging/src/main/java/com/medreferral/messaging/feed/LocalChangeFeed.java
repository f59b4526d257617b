package com.medreferral.messaging.feed;

import com.medreferral.core.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * In-process feed for single-node deployments and tests. Publication is synchronous on subscribe.
 */
public class LocalChangeFeed extends AbstractChangeFeed {
    private static final Logger log = LoggerFactory.getLogger(LocalChangeFeed.class);

    @Override
    public Mono<Void> start() {
        log.info("Local change feed started");
        return Mono.empty();
    }

    @Override
    public Mono<Void> publish(Message message) {
        return Mono.fromRunnable(() -> emit(message));
    }

    /**
     * Simulates a transport drop: current subscribers fail with a transient error.
     */
    public void interrupt() {
        disconnect(new IllegalStateException("local feed interrupted"));
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(this::completeSubscribers);
    }

    @Override
    public String transport() {
        return "local";
    }
}
