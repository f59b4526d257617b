package com.medreferral.core.metrics;

/**
 * Micrometer metric names.
 * <p>
 * <b>Naming convention:</b> {@code dm.<component>.<metric>}
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: append attempts. Tags: outcome (ok/rejected/failed).
     */
    public static final String SEND_TOTAL = "dm.store.send.total";

    /**
     * Timer: append latency including the feed publication.
     */
    public static final String SEND_LATENCY = "dm.store.send.latency";

    /**
     * Counter: messages flipped to read. Tags: none.
     */
    public static final String READ_TOTAL = "dm.store.read.total";

    /**
     * Counter: feed publications that failed after the row was stored. Tags: transport.
     */
    public static final String FEED_PUBLISH_FAILURES = "dm.feed.publish.failures.total";

    /**
     * Counter: insert events delivered to sessions.
     */
    public static final String FEED_DELIVERED = "dm.feed.delivered.total";

    /**
     * Counter: feed disconnects seen by subscribers.
     */
    public static final String FEED_DISCONNECTS = "dm.feed.disconnects.total";

    /**
     * Counter: reconciliation fetches after resubscribe. Tags: outcome.
     */
    public static final String FEED_RECONCILE = "dm.feed.reconcile.total";

    /**
     * Gauge: open client sessions on this node.
     */
    public static final String ACTIVE_SESSIONS = "dm.sessions.active";

    /**
     * Counter: HTTP API errors. Tags: reason (validation/authorization/authentication/transient/internal).
     */
    public static final String API_ERRORS = "dm.api.errors.total";
}
