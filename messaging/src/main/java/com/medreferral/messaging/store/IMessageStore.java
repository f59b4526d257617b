package com.medreferral.messaging.store;

import com.medreferral.core.model.Message;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Durable log of direct messages; the single source of truth for every session.
 * <p>
 * Every operation takes the acting identity explicitly. Failures are signalled as
 * {@code ValidationException}, {@code AuthorizationException} or {@code TransientException};
 * none of them is retried here.
 * </p>
 */
public interface IMessageStore {

    /**
     * Stores a new message and publishes it on the change feed.
     *
     * @param senderId    author (the authenticated user)
     * @param recipientId addressee, must differ from {@code senderId}
     * @param body        text; stored trimmed, must not be blank
     * @return Mono of the stored message with its id and createdAt assigned
     */
    Mono<Message> append(String senderId, String recipientId, String body);

    /**
     * All messages exchanged between {@code userA} and {@code userB}, oldest first.
     *
     * @param requesterId acting user; must be one of the two participants
     */
    Flux<Message> fetchThread(String requesterId, String userA, String userB);

    /**
     * All messages sent or received by {@code userId}, newest first.
     */
    Flux<Message> fetchInvolving(String userId);

    /**
     * Marks messages read in one batch. Already-read ids are no-ops.
     *
     * @param requesterId acting user; must be the recipient of every id
     * @param ids         message ids
     * @return Mono of the number of messages that changed from unread to read
     */
    Mono<Integer> markRead(String requesterId, Set<String> ids);
}
