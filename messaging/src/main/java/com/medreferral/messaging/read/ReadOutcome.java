package com.medreferral.messaging.read;

import com.medreferral.core.model.Message;
import lombok.Value;

import java.util.List;

/**
 * Result of opening a thread.
 */
@Value
public class ReadOutcome {
    String counterpartId;

    /**
     * The thread oldest first, with the messages read by this call already shown as read.
     */
    List<Message> thread;

    /**
     * Messages this call moved from unread to read in the store (0 when another session got there first).
     */
    int newlyRead;

    /**
     * Unread count left in the session's view; non-zero only for messages that arrived after the fetch.
     */
    int remainingUnread;
}
