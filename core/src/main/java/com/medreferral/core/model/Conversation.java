package com.medreferral.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Comparator;

/**
 * Derived summary of the thread between an owner and one counterpart.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Conversation {

    /**
     * Most recent first; equal times fall back to counterpart id ascending.
     */
    public static final Comparator<Conversation> LIST_ORDER = Comparator
        .comparing(Conversation::getLastMessageTime, Comparator.reverseOrder())
        .thenComparing(Conversation::getCounterpartId);

    String counterpartId;
    String lastMessageId;
    String lastMessageSenderId;
    String lastMessageBody;
    Instant lastMessageTime;
    int unreadCount;
}
