package com.medreferral.core.model;

/**
 * Order-independent key for a two-party thread: {@code min(a,b)|max(a,b)}.
 * <p>
 * Used as the Kafka partition key (per-pair ordering) and as the lock stripe key in the store.
 * </p>
 */
public final class PairKey {
    private static final String DELIMITER = "|";

    private PairKey() {
    }

    public static String of(String userA, String userB) {
        return userA.compareTo(userB) <= 0
            ? userA + DELIMITER + userB
            : userB + DELIMITER + userA;
    }
}
