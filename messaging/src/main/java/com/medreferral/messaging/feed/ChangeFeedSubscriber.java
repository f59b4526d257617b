package com.medreferral.messaging.feed;

import com.medreferral.core.model.Message;
import com.medreferral.core.util.JitterBackoff;
import com.medreferral.messaging.metrics.MetricsService;
import com.medreferral.messaging.store.IMessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-session listener on the change feed.
 * <p>
 * Delivers only inserts whose sender or recipient is the session's user. On a feed error it marks the view
 * stale, waits a jittered backoff, <b>resubscribes first and then</b> fetches everything involving the user
 * and hands that to the listener. Inserts arriving while the fetch runs are appended to the reconciled
 * list so nothing slips between the query and the callback. Only the newest fetch is delivered, and only if
 * the feed stayed up while it ran.
 * </p>
 * <p>
 * {@link #close()} is idempotent and safe from any thread, including from inside a callback; once it returns
 * no callback runs.
 * </p>
 */
public class ChangeFeedSubscriber {
    private static final Logger log = LoggerFactory.getLogger(ChangeFeedSubscriber.class);

    private final String userId;
    private final IChangeFeed feed;
    private final IMessageStore store;
    private final ChangeFeedListener listener;
    private final JitterBackoff backoff;
    private final Scheduler timer;
    private final MetricsService metricsService;

    private final Object callbackLock = new Object();
    private final Disposable.Swap feedSubscription = Disposables.swap();
    private final Disposable.Swap fetch = Disposables.swap();
    private final Disposable.Swap retryTimer = Disposables.swap();
    private final AtomicInteger attempts = new AtomicInteger();

    // guarded by callbackLock
    private boolean closed;
    private boolean feedLive;
    private long generation;
    private List<Message> insertedDuringFetch;

    public ChangeFeedSubscriber(String userId,
                                IChangeFeed feed,
                                IMessageStore store,
                                ChangeFeedListener listener,
                                JitterBackoff backoff,
                                Scheduler timer,
                                MetricsService metricsService) {
        this.userId = userId;
        this.feed = feed;
        this.store = store;
        this.listener = listener;
        this.backoff = backoff;
        this.timer = timer;
        this.metricsService = metricsService;
    }

    /**
     * Subscribes to the feed, then runs the initial reconciliation fetch.
     */
    public void start() {
        subscribeFeed();
        fetchAndReconcile();
    }

    public String getUserId() {
        return userId;
    }

    public boolean isClosed() {
        synchronized (callbackLock) {
            return closed;
        }
    }

    private void subscribeFeed() {
        synchronized (callbackLock) {
            if (closed) {
                return;
            }
            // Set before subscribing: a synchronous error clears it again
            feedLive = true;
        }
        feedSubscription.update(feed.inserts()
            .filter(message -> message.involves(userId))
            .subscribe(this::onFeedMessage, this::onFeedError));
        log.debug("Feed subscription active for user {}", userId);
    }

    private void onFeedMessage(Message message) {
        synchronized (callbackLock) {
            if (closed) {
                return;
            }
            if (insertedDuringFetch != null) {
                insertedDuringFetch.add(message);
            }
            metricsService.recordFeedDelivered();
            invoke(() -> listener.onInserted(message));
        }
    }

    private void onFeedError(Throwable err) {
        synchronized (callbackLock) {
            if (closed) {
                return;
            }
            feedLive = false;
            // A fetch in flight cannot account for inserts lost with the subscription
            generation++;
            insertedDuringFetch = null;
        }
        metricsService.recordFeedDisconnect();
        log.warn("Feed lost for user {}: {}", userId, err.getMessage());
        deliver(() -> listener.onStale(err));
        schedule(() -> {
            subscribeFeed();
            fetchAndReconcile();
        });
    }

    /**
     * Fetches everything involving the user and hands it to {@link ChangeFeedListener#onReconciled}.
     * When the feed is down the subscriber resubscribes first instead of waiting for the pending retry.
     * A failure reports stale and retries with backoff.
     */
    public void reconcile() {
        boolean resubscribe;
        synchronized (callbackLock) {
            if (closed) {
                return;
            }
            resubscribe = !feedLive;
        }
        if (resubscribe) {
            retryTimer.update(Disposables.disposed());
            subscribeFeed();
        }
        fetchAndReconcile();
    }

    private void fetchAndReconcile() {
        long fetchGeneration;
        synchronized (callbackLock) {
            if (closed) {
                return;
            }
            fetchGeneration = ++generation;
            insertedDuringFetch = new ArrayList<>();
        }

        fetch.update(store.fetchInvolving(userId)
            .collectList()
            .subscribe(snapshot -> onFetched(fetchGeneration, snapshot), err -> onFetchFailed(fetchGeneration, err)));
    }

    private void onFetched(long fetchGeneration, List<Message> snapshot) {
        synchronized (callbackLock) {
            if (closed) {
                return;
            }
            if (fetchGeneration != generation || !feedLive) {
                log.debug("Dropping superseded fetch {} for user {}", fetchGeneration, userId);
                return;
            }
            List<Message> involving = new ArrayList<>(snapshot);
            if (insertedDuringFetch != null) {
                involving.addAll(insertedDuringFetch);
                insertedDuringFetch = null;
            }
            attempts.set(0);
            metricsService.recordReconcile(true);
            log.debug("Reconciled user {} with {} messages", userId, involving.size());
            invoke(() -> listener.onReconciled(involving));
        }
    }

    private void onFetchFailed(long fetchGeneration, Throwable err) {
        synchronized (callbackLock) {
            if (closed || fetchGeneration != generation) {
                return;
            }
        }
        metricsService.recordReconcile(false);
        log.warn("Reconciliation fetch failed for user {}: {}", userId, err.getMessage());
        deliver(() -> listener.onStale(err));
        schedule(this::fetchAndReconcile);
    }

    private void schedule(Runnable action) {
        if (isClosed()) {
            return;
        }
        Duration delay = backoff.next(attempts.getAndIncrement());
        log.debug("Retrying feed for user {} in {} ms", userId, delay.toMillis());
        retryTimer.update(Mono.delay(delay, timer).subscribe(tick -> action.run()));
    }

    private void deliver(Runnable callback) {
        synchronized (callbackLock) {
            if (!closed) {
                invoke(callback);
            }
        }
    }

    private void invoke(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Feed listener failed for user {}", userId, e);
        }
    }

    /**
     * Stops delivery. No callback fires after this returns.
     */
    public void close() {
        synchronized (callbackLock) {
            if (closed) {
                return;
            }
            closed = true;
            insertedDuringFetch = null;
        }
        feedSubscription.dispose();
        fetch.dispose();
        retryTimer.dispose();
        log.debug("Feed subscriber closed for user {}", userId);
    }
}
