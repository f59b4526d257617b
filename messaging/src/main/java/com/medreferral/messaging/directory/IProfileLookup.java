package com.medreferral.messaging.directory;

import com.medreferral.core.model.Conversation;
import com.medreferral.core.model.ConversationView;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Display names from the user directory. Names are presentation only.
 */
public interface IProfileLookup {

    /**
     * Names of the given users; users without a profile are absent.
     */
    Mono<Map<String, String>> displayNames(Collection<String> userIds);

    /**
     * Renders conversations with their counterparts' names, keeping the list order.
     */
    default Mono<List<ConversationView>> views(List<Conversation> conversations) {
        if (conversations.isEmpty()) {
            return Mono.just(List.of());
        }
        List<String> counterparts = conversations.stream().map(Conversation::getCounterpartId).toList();
        return displayNames(counterparts)
            .map(names -> conversations.stream()
                .map(c -> ConversationView.of(c, names.get(c.getCounterpartId())))
                .toList());
    }

    /**
     * Lookup for deployments without a directory: every name resolves to "Unknown".
     */
    static IProfileLookup unknown() {
        return userIds -> Mono.just(Map.of());
    }
}
