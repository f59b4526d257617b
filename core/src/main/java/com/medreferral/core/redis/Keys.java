package com.medreferral.core.redis;

/**
 * Redis keyspace definitions.
 */
public final class Keys {
    private Keys() {
    }

    /**
     * Presence of a user: {@code presence:{userId}}
     * <p>
     * <b>Type:</b> Hash, field = sessionId, value = nodeId
     * <br>
     * <b>TTL:</b> per field, refreshed by the owning node while the session lives; fields are removed on close.
     * </p>
     */
    public static String presence(String userId) {
        return "presence:" + userId;
    }

    /**
     * Profile directory entry: {@code profile:{userId}}
     * <p>
     * <b>Type:</b> Hash with at least {@code fullName}. Written by the directory service, read-only here.
     * </p>
     */
    public static String profile(String userId) {
        return "profile:" + userId;
    }

    public static final String PROFILE_NAME_FIELD = "fullName";
}
