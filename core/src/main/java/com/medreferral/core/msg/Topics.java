package com.medreferral.core.msg;

public final class Topics {
    private Topics() {
    }

    /**
     * Insert notifications for direct messages (serialized {@code Message}).
     * Keyed by pair key so each thread stays on one partition.
     */
    public static final String MESSAGES_INSERTED = "dm.messages.inserted";

    private static final String FEED_GROUP_PREFIX = "dm-feed-";

    /**
     * Every node consumes with its own group so each node sees every insert.
     *
     * @param nodeId Node identifier
     * @return consumer group id: dm-feed-{nodeId}
     */
    public static String feedGroupFor(String nodeId) {
        return FEED_GROUP_PREFIX + nodeId;
    }
}
