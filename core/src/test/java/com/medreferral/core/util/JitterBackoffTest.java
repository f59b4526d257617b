package com.medreferral.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JitterBackoffTest {

    @Test
    void testExponentialGrowthWithoutJitter() {
        JitterBackoff backoff = new JitterBackoff(Duration.ofMillis(100), Duration.ofSeconds(1), Duration.ZERO);

        assertEquals(Duration.ofMillis(100), backoff.next(0));
        assertEquals(Duration.ofMillis(200), backoff.next(1));
        assertEquals(Duration.ofMillis(800), backoff.next(3));
        assertEquals(Duration.ofSeconds(1), backoff.next(4), "Capped at max");
        assertEquals(Duration.ofSeconds(1), backoff.next(1_000), "Huge attempts do not overflow");
    }

    @Test
    void testJitterStaysWithinBounds() {
        JitterBackoff backoff = new JitterBackoff(Duration.ofMillis(100), Duration.ofSeconds(1),
            Duration.ofMillis(50));

        for (int i = 0; i < 100; i++) {
            long ms = backoff.next(0).toMillis();
            assertTrue(ms >= 100 && ms <= 150, "Got " + ms);
        }
    }

    @Test
    void testNegativeDurationsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new JitterBackoff(Duration.ofMillis(-1), Duration.ofSeconds(1), Duration.ZERO));
    }
}
