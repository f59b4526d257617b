package com.medreferral.messaging.feed;

import com.medreferral.core.error.TransientException;
import com.medreferral.core.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Local fan-out shared by all transports: one multicast sink, swapped for a fresh one on disconnect.
 */
public abstract class AbstractChangeFeed implements IChangeFeed {
    private static final Logger log = LoggerFactory.getLogger(AbstractChangeFeed.class);

    private final Object emitLock = new Object();
    private volatile Sinks.Many<Message> hub = newHub();

    private static Sinks.Many<Message> newHub() {
        return Sinks.many().multicast().directBestEffort();
    }

    @Override
    public Flux<Message> inserts() {
        return Flux.defer(() -> hub.asFlux());
    }

    /**
     * Fans a message out to the current subscribers. Emissions are serialized across publishing threads.
     */
    protected void emit(Message message) {
        synchronized (emitLock) {
            Sinks.EmitResult result = hub.tryEmitNext(message);
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                log.warn("Failed to fan out message {} on {} feed: {}", message.getId(), transport(), result);
            }
        }
    }

    /**
     * Terminates current subscribers with a {@link TransientException} and opens a fresh channel.
     */
    protected void disconnect(Throwable cause) {
        Sinks.Many<Message> previous;
        synchronized (emitLock) {
            previous = hub;
            hub = newHub();
        }
        log.warn("{} feed disconnected: {}", transport(), cause.getMessage());
        previous.tryEmitError(new TransientException("Change feed disconnected", cause));
    }

    protected void completeSubscribers() {
        synchronized (emitLock) {
            hub.tryEmitComplete();
        }
    }
}
