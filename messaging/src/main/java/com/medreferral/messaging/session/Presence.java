package com.medreferral.messaging.session;

import lombok.Value;

import java.util.Set;

/**
 * Whether a user has open sessions, and on which nodes.
 */
@Value
public class Presence {
    String userId;
    boolean online;
    int sessions;
    Set<String> nodes;

    public static Presence offline(String userId) {
        return new Presence(userId, false, 0, Set.of());
    }
}
