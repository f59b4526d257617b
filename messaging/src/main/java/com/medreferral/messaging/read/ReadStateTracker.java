package com.medreferral.messaging.read;

import com.medreferral.core.aggregate.ConversationAggregator;
import com.medreferral.core.error.ValidationException;
import com.medreferral.core.model.Message;
import com.medreferral.messaging.store.IMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import javax.annotation.Nullable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies read transitions when a user opens a conversation.
 * <p>
 * The aggregator is told which received messages of the fetched thread are now read (by this call or by
 * a concurrent session of the same user), not how many. Two sessions opening the same thread together
 * therefore both end at zero, and a message that arrives after the fetch stays unread.
 * </p>
 */
public class ReadStateTracker {
    private static final Logger log = LoggerFactory.getLogger(ReadStateTracker.class);

    private final IMessageStore store;

    public ReadStateTracker(IMessageStore store) {
        this.store = store;
    }

    public Mono<ReadOutcome> open(String owner, String counterpart) {
        return open(owner, counterpart, null);
    }

    /**
     * Fetches the thread, marks every unread message addressed to {@code owner} read in one batch and
     * updates {@code aggregator}.
     */
    public Mono<ReadOutcome> open(String owner, String counterpart, @Nullable ConversationAggregator aggregator) {
        try {
            requireCounterpart(owner, counterpart);
        } catch (ValidationException e) {
            return Mono.error(e);
        }
        return store.fetchThread(owner, owner, counterpart)
            .collectList()
            .flatMap(thread -> {
                Set<String> received = new LinkedHashSet<>();
                Set<String> unread = new LinkedHashSet<>();
                for (Message message : thread) {
                    if (message.isAddressedTo(owner)) {
                        received.add(message.getId());
                        if (!message.isRead()) {
                            unread.add(message.getId());
                        }
                    }
                }

                Mono<Integer> marking = unread.isEmpty() ? Mono.just(0) : store.markRead(owner, unread);

                return marking.map(newlyRead -> {
                    int remaining = 0;
                    if (aggregator != null) {
                        aggregator.applyRead(counterpart, received);
                        remaining = aggregator.unreadCount(counterpart);
                    }
                    log.debug("User {} opened thread with {}: {} unread in snapshot, {} newly read, {} remaining",
                        owner, counterpart, unread.size(), newlyRead, remaining);

                    List<Message> shown = thread.stream()
                        .map(m -> unread.contains(m.getId()) ? m.withRead(true) : m)
                        .toList();
                    return new ReadOutcome(counterpart, shown, newlyRead, remaining);
                });
            });
    }

    /**
     * A thread needs another, non-blank user on the other side.
     */
    public static void requireCounterpart(String owner, @Nullable String counterpart) {
        if (counterpart == null || counterpart.isBlank() || counterpart.equals(owner)) {
            throw new ValidationException("counterpartId must name another user");
        }
    }

    /**
     * Marks a single message read as it arrives in the thread the user is looking at.
     *
     * @return Mono of {@code true} if the store changed
     */
    public Mono<Boolean> markDelivered(String owner, Message message, @Nullable ConversationAggregator aggregator) {
        if (!message.isAddressedTo(owner) || message.isRead()) {
            return Mono.just(false);
        }
        Set<String> ids = Set.of(message.getId());
        return store.markRead(owner, ids)
            .map(updated -> {
                if (aggregator != null) {
                    aggregator.applyRead(message.counterpartOf(owner), ids);
                }
                return updated > 0;
            });
    }
}
