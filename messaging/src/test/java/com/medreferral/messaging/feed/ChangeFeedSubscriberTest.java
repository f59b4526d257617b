package com.medreferral.messaging.feed;

import com.medreferral.core.aggregate.ConversationAggregator;
import com.medreferral.core.model.Conversation;
import com.medreferral.core.model.Message;
import com.medreferral.core.util.JitterBackoff;
import com.medreferral.messaging.metrics.MetricsService;
import com.medreferral.messaging.store.IMessageStore;
import com.medreferral.messaging.store.JdbcMessageStore;
import com.medreferral.messaging.support.FlakyMessageStore;
import com.medreferral.messaging.support.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChangeFeedSubscriberTest {

    private static final JitterBackoff BACKOFF =
        new JitterBackoff(Duration.ofMillis(100), Duration.ofSeconds(2), Duration.ZERO);

    private LocalChangeFeed feed;
    private MetricsService metrics;
    private JdbcMessageStore store;
    private FlakyMessageStore flaky;
    private VirtualTimeScheduler timer;
    private RecordingListener listener;
    private ChangeFeedSubscriber subscriber;

    @BeforeEach
    void setUp() {
        feed = new LocalChangeFeed();
        metrics = TestStores.metrics();
        store = TestStores.synchronous(feed, metrics);
        flaky = new FlakyMessageStore(store);
        timer = VirtualTimeScheduler.create();
        listener = new RecordingListener();
        subscriber = new ChangeFeedSubscriber("B", feed, flaky, listener, BACKOFF, timer, metrics);
    }

    @AfterEach
    void tearDown() {
        subscriber.close();
        timer.dispose();
    }

    @Test
    @DisplayName("Start installs stored messages, then delivers only inserts involving the user")
    void testStartAndFilter() {
        Message before = store.append("A", "B", "before").block();

        subscriber.start();

        assertEquals(List.of(List.of(before)), listener.reconciled);

        store.append("A", "C", "not for B").block();
        Message live = store.append("A", "B", "live").block();
        Message own = store.append("B", "C", "sent by B").block();

        assertEquals(List.of(live, own), listener.inserted);
    }

    @Test
    @DisplayName("After a disconnect the subscriber resubscribes and reconciles missed messages")
    void testReconnectReconciles() {
        subscriber.start();
        feed.interrupt();

        assertEquals(1, listener.stale.size());

        store.append("A", "B", "Hi").block();
        store.append("A", "B", "There").block();
        assertTrue(listener.inserted.isEmpty(), "Nothing is delivered while disconnected");

        timer.advanceTimeBy(Duration.ofMillis(100));

        assertEquals(2, listener.reconciled.size());
        ConversationAggregator aggregator = new ConversationAggregator("B");
        aggregator.replaceAll(listener.reconciled.get(1));
        Conversation withA = aggregator.get("A").orElseThrow();
        assertEquals("There", withA.getLastMessageBody());
        assertEquals(2, withA.getUnreadCount());

        Message next = store.append("A", "B", "back online").block();
        assertEquals(List.of(next), listener.inserted);
    }

    @Test
    @DisplayName("A failed reconciliation reports stale and retries with a longer backoff")
    void testReconcileRetry() {
        subscriber.start();
        flaky.failFetches(true);
        feed.interrupt();

        timer.advanceTimeBy(Duration.ofMillis(100));
        assertEquals(2, listener.stale.size(), "Disconnect plus failed fetch");
        assertEquals(1, listener.reconciled.size());

        flaky.failFetches(false);
        timer.advanceTimeBy(Duration.ofMillis(199));
        assertEquals(1, listener.reconciled.size());

        timer.advanceTimeBy(Duration.ofMillis(1));
        assertEquals(2, listener.reconciled.size());
    }

    @Test
    @DisplayName("No callback fires after close, including a pending reconnect")
    void testCloseStopsCallbacks() {
        subscriber.start();
        feed.interrupt();
        int fetchesBefore = flaky.involvingFetches();

        subscriber.close();
        subscriber.close();
        timer.advanceTimeBy(Duration.ofSeconds(10));
        store.append("A", "B", "after close").block();

        assertEquals(fetchesBefore, flaky.involvingFetches());
        assertEquals(1, listener.reconciled.size());
        assertTrue(listener.inserted.isEmpty());
        assertTrue(subscriber.isClosed());
    }

    @Test
    @DisplayName("Inserts that arrive while the fetch runs are appended to the reconciled list")
    void testInsertDuringFetch() {
        Sinks.One<List<Message>> pendingFetch = Sinks.one();
        IMessageStore slowStore = new FlakyMessageStore(store) {
            @Override
            public Flux<Message> fetchInvolving(String userId) {
                return pendingFetch.asMono().flatMapIterable(list -> list);
            }
        };
        ChangeFeedSubscriber slow = new ChangeFeedSubscriber("B", feed, slowStore, listener, BACKOFF, timer, metrics);
        slow.start();

        Message snapshotted = message("m1", "A", "B", 1);
        Message duringFetch = message("m2", "A", "B", 2);
        feed.publish(duringFetch).block();
        pendingFetch.tryEmitValue(List.of(snapshotted));

        assertEquals(List.of(duringFetch), listener.inserted);
        assertEquals(List.of(List.of(snapshotted, duringFetch)), listener.reconciled);
        slow.close();
    }

    @Test
    @DisplayName("A refresh while the feed is down resubscribes before reconciling")
    void testRefreshWhileDisconnected() {
        subscriber.start();
        feed.interrupt();
        assertEquals(1, listener.stale.size());

        subscriber.reconcile();

        assertEquals(2, listener.reconciled.size());
        Message live = store.append("A", "B", "after refresh").block();
        assertEquals(List.of(live), listener.inserted);

        int fetches = flaky.involvingFetches();
        timer.advanceTimeBy(Duration.ofSeconds(10));
        assertEquals(fetches, flaky.involvingFetches(), "The pending reconnect was cancelled");
        assertEquals(2, listener.reconciled.size());
    }

    @Test
    @DisplayName("A fetch that completes after the feed was lost does not clear the stale view")
    void testFetchOutlivedByDisconnect() {
        QueuedFetchStore queued = new QueuedFetchStore(store);
        ChangeFeedSubscriber slow = new ChangeFeedSubscriber("B", feed, queued, listener, BACKOFF, timer, metrics);
        slow.start();

        feed.interrupt();
        Message snapshotted = message("m1", "A", "B", 1);
        queued.complete(0, List.of(snapshotted));

        assertEquals(1, listener.stale.size());
        assertTrue(listener.reconciled.isEmpty());

        timer.advanceTimeBy(Duration.ofMillis(100));
        assertEquals(2, queued.pending.size());
        queued.complete(1, List.of(snapshotted));

        assertEquals(List.of(List.of(snapshotted)), listener.reconciled);
        slow.close();
    }

    @Test
    @DisplayName("Overlapping reconciliations deliver only the newest, with inserts seen during it")
    void testOverlappingReconciles() {
        QueuedFetchStore queued = new QueuedFetchStore(store);
        ChangeFeedSubscriber slow = new ChangeFeedSubscriber("B", feed, queued, listener, BACKOFF, timer, metrics);
        slow.start();
        slow.reconcile();

        Message snapshotted = message("m1", "A", "B", 1);
        Message duringFetch = message("m2", "A", "B", 2);
        feed.publish(duringFetch).block();
        queued.complete(0, List.of(snapshotted));
        queued.complete(1, List.of(snapshotted));

        assertEquals(List.of(List.of(snapshotted, duringFetch)), listener.reconciled);
        slow.close();
    }

    @Test
    @DisplayName("A failing listener does not break the subscription")
    void testListenerFailureIsContained() {
        listener.failNextInsert = true;
        subscriber.start();

        store.append("A", "B", "first").block();
        Message second = store.append("A", "B", "second").block();

        assertEquals(List.of(second), listener.inserted);
    }

    private static Message message(String id, String from, String to, int second) {
        return Message.builder()
            .id(id)
            .senderId(from)
            .recipientId(to)
            .body(id)
            .createdAt(Instant.parse("2024-05-01T10:00:00Z").plusSeconds(second))
            .build();
    }

    private static final class QueuedFetchStore extends FlakyMessageStore {
        final List<Sinks.One<List<Message>>> pending = new CopyOnWriteArrayList<>();

        QueuedFetchStore(IMessageStore delegate) {
            super(delegate);
        }

        @Override
        public Flux<Message> fetchInvolving(String userId) {
            Sinks.One<List<Message>> fetch = Sinks.one();
            pending.add(fetch);
            return fetch.asMono().flatMapIterable(list -> list);
        }

        void complete(int index, List<Message> snapshot) {
            pending.get(index).tryEmitValue(snapshot);
        }
    }

    private static final class RecordingListener implements ChangeFeedListener {
        final List<Message> inserted = new CopyOnWriteArrayList<>();
        final List<List<Message>> reconciled = new CopyOnWriteArrayList<>();
        final List<Throwable> stale = new CopyOnWriteArrayList<>();
        volatile boolean failNextInsert;

        @Override
        public void onInserted(Message message) {
            if (failNextInsert) {
                failNextInsert = false;
                throw new IllegalStateException("listener bug");
            }
            inserted.add(message);
        }

        @Override
        public void onReconciled(List<Message> involving) {
            reconciled.add(List.copyOf(involving));
        }

        @Override
        public void onStale(Throwable cause) {
            stale.add(cause);
        }
    }
}
