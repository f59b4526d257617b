package com.medreferral.core.aggregate;

import com.medreferral.core.model.Message;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Drives an in-memory "store" with random sends and reads, mirrors every change into an incrementally
 * maintained aggregator and compares it with a full rescan after each step.
 */
class RescanEquivalenceTest {

    private static final String OWNER = "A";
    private static final List<String> USERS = List.of("A", "B", "C", "D");
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static final AtomicInteger SEED = new AtomicInteger(42);

    @RepeatedTest(20)
    @DisplayName("Incremental view equals a full rescan after every step of a random interleaving")
    void testRandomInterleaving() {
        Random random = new Random(SEED.getAndIncrement());
        Map<String, Message> store = new LinkedHashMap<>();
        ConversationAggregator incremental = new ConversationAggregator(OWNER);
        int clock = 0;

        for (int step = 0; step < 200; step++) {
            if (store.isEmpty() || random.nextInt(3) != 0) {
                String from = USERS.get(random.nextInt(USERS.size()));
                String to = USERS.get(random.nextInt(USERS.size()));
                if (from.equals(to)) {
                    continue;
                }
                Message m = Message.builder()
                    .id("m" + step)
                    .senderId(from)
                    .recipientId(to)
                    .body("body " + step)
                    // several messages per second exercise the id tie-break
                    .createdAt(T0.plusSeconds(clock += random.nextInt(2)))
                    .build();
                store.put(m.getId(), m);
                incremental.applyInserted(m);
                if (random.nextBoolean()) {
                    incremental.applyInserted(m);
                }
            } else {
                String counterpart = USERS.get(1 + random.nextInt(USERS.size() - 1));
                List<String> newlyRead = new ArrayList<>();
                for (Message m : store.values()) {
                    if (m.getRecipientId().equals(OWNER) && m.getSenderId().equals(counterpart) && !m.isRead()
                        && random.nextBoolean()) {
                        newlyRead.add(m.getId());
                    }
                }
                newlyRead.forEach(id -> store.computeIfPresent(id, (k, m) -> m.withRead(true)));
                incremental.applyRead(counterpart, newlyRead);
            }

            assertEquals(ConversationAggregator.rescan(OWNER, store.values()), incremental.snapshot(),
                "Diverged at step " + step);
        }

        ConversationAggregator refreshed = new ConversationAggregator(OWNER);
        refreshed.replaceAll(store.values());
        assertEquals(incremental.snapshot(), refreshed.snapshot());
    }

    @Test
    @DisplayName("Unread count equals the number of unread messages from the counterpart")
    void testUnreadCountDefinition() {
        List<Message> messages = List.of(
            Message.builder().id("1").senderId("B").recipientId("A").body("x").createdAt(T0).build(),
            Message.builder().id("2").senderId("B").recipientId("A").body("x").createdAt(T0.plusSeconds(1))
                .read(true).build(),
            Message.builder().id("3").senderId("A").recipientId("B").body("x").createdAt(T0.plusSeconds(2))
                .build(),
            Message.builder().id("4").senderId("C").recipientId("A").body("x").createdAt(T0.plusSeconds(3))
                .build()
        );

        ConversationAggregator aggregator = new ConversationAggregator(OWNER);
        aggregator.replaceAll(messages);

        assertEquals(1, aggregator.unreadCount("B"));
        assertEquals(1, aggregator.unreadCount("C"));
        assertEquals(Set.of("1"), aggregator.unreadIds("B"));
        assertEquals(2, ConversationAggregator.rescan(OWNER, messages).size());
    }
}
