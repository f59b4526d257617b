package com.medreferral.messaging.feed;

import com.medreferral.core.model.Message;

import java.util.List;

/**
 * Typed inbound channel of one session. Callbacks are serialized and never run after
 * {@link ChangeFeedSubscriber#close()} returns.
 */
public interface ChangeFeedListener {

    /**
     * A message involving the session's user was inserted. May repeat for the same id.
     */
    void onInserted(Message message);

    /**
     * Full state after (re)subscribing: everything involving the user, as fetched, followed by any inserts
     * that arrived while the fetch was running. The fetched copy of a message comes first.
     */
    void onReconciled(List<Message> involving);

    /**
     * The feed dropped or a reconciliation fetch failed; the current view may be behind until the next
     * {@link #onReconciled}.
     */
    void onStale(Throwable cause);
}
