package com.medreferral.messaging.feed;

import com.medreferral.core.model.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Node-wide channel of newly inserted messages, independent of the transport behind it.
 * <p>
 * <b>Ordering:</b> messages of one pair are delivered in the order {@link #publish} was called for them;
 * nothing is promised across pairs.
 * </p>
 * <p>
 * <b>At-least-once:</b> consumers deduplicate on message id.
 * </p>
 * <p>
 * <b>Disconnects:</b> a transport failure terminates every current {@link #inserts()} subscription with a
 * {@code TransientException}. Subscribing again attaches to the restored channel. Messages published while
 * nobody is subscribed are not replayed; consumers reconcile with a fetch.
 * </p>
 */
public interface IChangeFeed {

    /**
     * Connects the transport.
     */
    Mono<Void> start();

    /**
     * Announces a stored message. Subscribing to the returned Mono submits the message, so callers that
     * must preserve per-pair order subscribe while holding the pair's lock.
     */
    Mono<Void> publish(Message message);

    /**
     * Hot stream of inserts seen by this node.
     */
    Flux<Message> inserts();

    Mono<Void> stop();

    /**
     * Short transport name used as a metrics tag.
     */
    String transport();
}
