package com.medreferral.core.aggregate;

import com.medreferral.core.model.Conversation;
import com.medreferral.core.model.Message;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Incrementally maintained conversation list for one owner.
 * <p>
 * <b>State:</b> counterpart → (latest message, ids of unread messages received from that counterpart),
 * plus the ids of every message already applied so feed duplicates are ignored.
 * </p>
 * <p>
 * <b>Equivalence:</b> for any set of messages, {@link #replaceAll(Collection)} followed by any sequence of
 * {@link #applyInserted(Message)} / {@link #applyRead(String, Collection)} mirroring the same inserts and
 * read transitions in the store yields exactly {@link #rescan(String, Collection)} of the store's
 * resulting contents. {@code replaceAll} is itself a fold of {@code applyInserted}, while {@code rescan}
 * is computed independently by partitioning, which is what the tests compare.
 * </p>
 * <p>
 * Unread counts are the size of an id set, so a read event can only remove ids that are currently
 * unread: {@code unread = max(0, previous - newlyRead)} holds by construction and never goes negative.
 * </p>
 * <p>
 * Thread-safe: a session's feed callbacks and fetch results may arrive on different threads.
 * </p>
 */
public class ConversationAggregator {

    /**
     * Ordering used to pick the latest message of a partition. Ids break ties so both paths agree.
     */
    static final Comparator<Message> RECENCY = Comparator
        .comparing(Message::getCreatedAt)
        .thenComparing(Message::getId);

    private final String owner;
    private final Map<String, Entry> entries = new HashMap<>();
    private final Set<String> appliedIds = new HashSet<>();

    public ConversationAggregator(String owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public String getOwner() {
        return owner;
    }

    /**
     * Derives the conversation list from scratch.
     * <ol>
     *   <li>Partition the messages involving {@code owner} by counterpart.</li>
     *   <li>Last message = the partition's maximum by createdAt.</li>
     *   <li>Unread = messages addressed to {@code owner} and not read.</li>
     *   <li>Sort by last message time descending, counterpart id ascending.</li>
     * </ol>
     * Messages not involving {@code owner} are ignored; duplicates by id count once.
     */
    public static List<Conversation> rescan(String owner, Collection<Message> messages) {
        Map<String, Message> distinct = new HashMap<>();
        for (Message message : messages) {
            if (message.involves(owner)) {
                distinct.putIfAbsent(message.getId(), message);
            }
        }

        Map<String, List<Message>> partitions = distinct.values().stream()
            .collect(Collectors.groupingBy(m -> m.counterpartOf(owner)));

        List<Conversation> result = new ArrayList<>(partitions.size());
        partitions.forEach((counterpart, partition) -> {
            Message last = partition.stream().max(RECENCY).orElseThrow();
            int unread = (int) partition.stream()
                .filter(m -> m.isAddressedTo(owner) && !m.isRead())
                .count();
            result.add(toConversation(counterpart, last, unread));
        });
        result.sort(Conversation.LIST_ORDER);
        return result;
    }

    /**
     * Replaces the whole view with a freshly fetched snapshot (full refresh / reconciliation).
     */
    public synchronized void replaceAll(Collection<Message> involving) {
        entries.clear();
        appliedIds.clear();

        List<Message> ascending = new ArrayList<>(involving);
        ascending.sort(RECENCY);
        for (Message message : ascending) {
            applyInsertedInternal(message);
        }
    }

    /**
     * Applies a new-message event.
     *
     * @return {@code true} if the view changed; {@code false} for duplicates and unrelated messages
     */
    public synchronized boolean applyInserted(Message message) {
        return applyInsertedInternal(message);
    }

    private boolean applyInsertedInternal(Message message) {
        if (!message.involves(owner) || !appliedIds.add(message.getId())) {
            return false;
        }

        String counterpart = message.counterpartOf(owner);
        Entry entry = entries.computeIfAbsent(counterpart, Entry::new);

        // createdAt is monotonic per store, so only a stale duplicate can be older than the current last
        if (entry.last == null || RECENCY.compare(message, entry.last) > 0) {
            entry.last = message;
        }
        if (message.isAddressedTo(owner) && !message.isRead()) {
            entry.unreadIds.add(message.getId());
        }
        return true;
    }

    /**
     * Applies a read-state event for {@code counterpart}.
     *
     * @param readIds ids now known to be read; ids that are not currently unread are ignored
     * @return number of messages that went from unread to read in this view
     */
    public synchronized int applyRead(String counterpart, Collection<String> readIds) {
        Entry entry = entries.get(counterpart);
        if (entry == null || readIds.isEmpty()) {
            return 0;
        }
        int before = entry.unreadIds.size();
        entry.unreadIds.removeAll(readIds);
        return before - entry.unreadIds.size();
    }

    public synchronized boolean hasApplied(String messageId) {
        return appliedIds.contains(messageId);
    }

    public synchronized int unreadCount(String counterpart) {
        Entry entry = entries.get(counterpart);
        return entry == null ? 0 : entry.unreadIds.size();
    }

    public synchronized int totalUnread() {
        return entries.values().stream().mapToInt(e -> e.unreadIds.size()).sum();
    }

    public synchronized Set<String> unreadIds(String counterpart) {
        Entry entry = entries.get(counterpart);
        return entry == null ? Set.of() : Set.copyOf(entry.unreadIds);
    }

    public synchronized Optional<Conversation> get(String counterpart) {
        return Optional.ofNullable(entries.get(counterpart)).map(Entry::toConversation);
    }

    /**
     * Sorted copy of the current list.
     */
    public synchronized List<Conversation> snapshot() {
        List<Conversation> result = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            result.add(entry.toConversation());
        }
        result.sort(Conversation.LIST_ORDER);
        return result;
    }

    private static Conversation toConversation(String counterpart, Message last, int unread) {
        Instant time = last.getCreatedAt();
        return Conversation.builder()
            .counterpartId(counterpart)
            .lastMessageId(last.getId())
            .lastMessageSenderId(last.getSenderId())
            .lastMessageBody(last.getBody())
            .lastMessageTime(time)
            .unreadCount(unread)
            .build();
    }

    private static final class Entry {
        private final String counterpartId;
        private final Set<String> unreadIds = new LinkedHashSet<>();
        private Message last;

        private Entry(String counterpartId) {
            this.counterpartId = counterpartId;
        }

        private Conversation toConversation() {
            return ConversationAggregator.toConversation(counterpartId, last, unreadIds.size());
        }
    }
}
