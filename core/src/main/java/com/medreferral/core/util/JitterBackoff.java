package com.medreferral.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff used when a change-feed subscription has to be re-established.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * </p>
 * <p>
 * Jitter spreads the resubscribe + reconciliation fetches of many sessions that lost the feed at the
 * same moment.
 * </p>
 */
public final class JitterBackoff {
    private static final int MAX_EXPONENT = 20;

    private final Duration base;
    private final Duration max;
    private final Duration jitterMax;

    public JitterBackoff(Duration base, Duration max, Duration jitterMax) {
        if (base.isNegative() || max.isNegative() || jitterMax.isNegative()) {
            throw new IllegalArgumentException("Backoff durations must not be negative");
        }
        this.base = base;
        this.max = max;
        this.jitterMax = jitterMax;
    }

    /**
     * base=500ms, max=30s, jitter=1s.
     */
    public static JitterBackoff defaults() {
        return new JitterBackoff(Duration.ofMillis(500), Duration.ofSeconds(30), Duration.ofSeconds(1));
    }

    /**
     * @param attempt 0-based retry attempt
     */
    public Duration next(int attempt) {
        long expMs = base.toMillis() * (1L << Math.min(Math.max(attempt, 0), MAX_EXPONENT));
        long cappedMs = Math.min(expMs, max.toMillis());
        long jitterMs = jitterMax.isZero() ? 0 : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);
        return Duration.ofMillis(cappedMs + jitterMs);
    }
}
