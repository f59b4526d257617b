package com.medreferral.core.msg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Frame sent by a client over the WebSocket.
 * <p>
 * Types:
 * <ul>
 *   <li>{@code open}: {counterpartId} opens a thread and marks it read</li>
 *   <li>{@code close}: leaves the open thread</li>
 *   <li>{@code send}: {recipientId, body}</li>
 *   <li>{@code refresh}: full rescan of the conversation list</li>
 *   <li>{@code ping}</li>
 * </ul>
 * </p>
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ClientCommand {
    public static final String OPEN = "open";
    public static final String CLOSE = "close";
    public static final String SEND = "send";
    public static final String REFRESH = "refresh";
    public static final String PING = "ping";

    /**
     * Echoed on the matching response so clients can correlate (optional).
     */
    String requestId;

    String type;

    String counterpartId;

    String recipientId;

    String body;
}
