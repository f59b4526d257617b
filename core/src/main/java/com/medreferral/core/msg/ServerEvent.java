package com.medreferral.core.msg;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.medreferral.core.model.Conversation;
import com.medreferral.core.model.ConversationView;
import com.medreferral.core.model.Message;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * Frame pushed to a client over the WebSocket.
 * <p>
 * <b>At-least-once:</b> {@code message} events may repeat after a feed reconnect; clients deduplicate on
 * {@code message.id}. {@code conversations} events always carry the full current list.
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerEvent {
    public static final String WELCOME = "welcome";
    public static final String CONVERSATIONS = "conversations";
    public static final String THREAD = "thread";
    public static final String MESSAGE = "message";
    public static final String SENT = "sent";
    public static final String STALE = "stale";
    public static final String ERROR = "error";
    public static final String PONG = "pong";

    String type;

    String requestId;

    String sessionId;

    String userId;

    String counterpartId;

    Message message;

    List<Message> messages;

    /**
     * Raw list as maintained by the session; rendered as {@code views} on the wire.
     */
    @JsonIgnore
    List<Conversation> conversations;

    List<ConversationView> views;

    Boolean stale;

    String error;

    String errorCode;

    long ts;
}
