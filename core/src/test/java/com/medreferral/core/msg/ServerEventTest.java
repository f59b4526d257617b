package com.medreferral.core.msg;

import com.fasterxml.jackson.databind.JsonNode;
import com.medreferral.core.error.ValidationException;
import com.medreferral.core.model.Conversation;
import com.medreferral.core.model.Message;
import com.medreferral.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServerEventTest {

    @Test
    void testWireFormatOmitsNullsAndRawConversations() throws Exception {
        Message message = Message.builder()
            .id("m1").senderId("B").recipientId("A").body("hi")
            .createdAt(Instant.parse("2024-05-01T10:00:00.123456Z"))
            .build();
        ServerEvent event = ServerEvent.builder()
            .type(ServerEvent.MESSAGE)
            .message(message)
            .conversations(List.of(Conversation.builder().counterpartId("B").build()))
            .ts(1L)
            .build();

        JsonNode json = JsonUtils.mapper().readTree(JsonUtils.writeValueAsString(event));

        assertEquals("message", json.get("type").asText());
        assertEquals("2024-05-01T10:00:00.123456Z", json.get("message").get("createdAt").asText());
        assertFalse(json.get("message").get("read").asBoolean());
        assertFalse(json.has("conversations"));
        assertFalse(json.has("requestId"));
        assertTrue(json.has("ts"));
    }

    @Test
    void testClientCommandParsing() {
        ClientCommand command = JsonUtils.readValue(
            "{\"type\":\"send\",\"recipientId\":\"B\",\"body\":\"hello\",\"extra\":1}", ClientCommand.class);

        assertEquals(ClientCommand.SEND, command.getType());
        assertEquals("B", command.getRecipientId());
        assertThrows(ValidationException.class, () -> JsonUtils.readValue("{not json", ClientCommand.class));
    }
}
