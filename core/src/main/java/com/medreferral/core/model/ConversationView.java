package com.medreferral.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A conversation enriched with the counterpart's display name, as rendered to clients.
 */
@Value
@Builder
@Jacksonized
public class ConversationView {
    public static final String UNKNOWN_NAME = "Unknown";

    String counterpartId;
    String counterpartName;
    String lastMessage;
    Instant lastMessageTime;
    int unreadCount;

    public static ConversationView of(Conversation conversation, String counterpartName) {
        return ConversationView.builder()
            .counterpartId(conversation.getCounterpartId())
            .counterpartName(counterpartName != null ? counterpartName : UNKNOWN_NAME)
            .lastMessage(conversation.getLastMessageBody())
            .lastMessageTime(conversation.getLastMessageTime())
            .unreadCount(conversation.getUnreadCount())
            .build();
    }
}
