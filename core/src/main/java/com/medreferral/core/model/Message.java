package com.medreferral.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A direct message between two users.
 * <p>
 * Immutable except for {@code read}, which only ever moves from {@code false} to {@code true}.
 * The id and {@code createdAt} are assigned by the message store at insert time.
 * </p>
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class Message {
    String id;
    String senderId;
    String recipientId;
    String body;
    Instant createdAt;
    boolean read;

    public boolean involves(String userId) {
        return senderId.equals(userId) || recipientId.equals(userId);
    }

    public boolean isAddressedTo(String userId) {
        return recipientId.equals(userId);
    }

    /**
     * The other participant relative to {@code owner}.
     *
     * @throws IllegalArgumentException if {@code owner} is not a participant
     */
    public String counterpartOf(String owner) {
        if (senderId.equals(owner)) {
            return recipientId;
        }
        if (recipientId.equals(owner)) {
            return senderId;
        }
        throw new IllegalArgumentException("User " + owner + " is not a participant of message " + id);
    }

    /**
     * Unordered pair key; identical for both directions of a thread.
     */
    public String pairKey() {
        return PairKey.of(senderId, recipientId);
    }
}
