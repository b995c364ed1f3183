package com.chattrix.websocket.handler;

import com.chattrix.websocket.config.RealtimeConfig;
import com.chattrix.websocket.domain.ClientCommand;
import com.chattrix.websocket.domain.CommandType;
import com.chattrix.websocket.exception.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClientEventDecoderTest {

    private final ClientEventDecoder decoder = new ClientEventDecoder(new RealtimeConfig().objectMapper());

    @Test
    void stringPayloadBecomesMessageText() {
        ClientCommand command = decoder.decode("{\"type\":\"message\",\"data\":\"hello there\"}");

        assertEquals(CommandType.SEND_PUBLIC_MESSAGE, command.getType());
        assertEquals("message", command.getEventName());
        assertEquals("hello there", command.getText());
    }

    @Test
    void messageFieldIsUsedWhenTextMissing() {
        ClientCommand command = decoder.decode(
                "{\"type\":\"private_message\",\"data\":{\"recipient_id\":\"12\",\"message\":\"psst\"}}");

        assertEquals(CommandType.SEND_PRIVATE_MESSAGE, command.getType());
        assertEquals(12L, command.getRecipientId());
        assertEquals("psst", command.getText());
    }

    @Test
    void typingFieldsAreRead() {
        ClientCommand command = decoder.decode(
                "{\"type\":\"typing\",\"data\":{\"chat_type\":\"private\",\"recipient_id\":3,\"is_typing\":true}}");

        assertEquals("private", command.getChatType());
        assertEquals(3L, command.getRecipientId());
        assertTrue(command.isTyping());
    }

    @Test
    void topLevelFieldsAreAcceptedWithoutData() {
        ClientCommand command = decoder.decode("{\"type\":\"pin_message\",\"message_id\":44}");

        assertEquals(CommandType.PIN_MESSAGE, command.getType());
        assertEquals(44L, command.getMessageId());
    }

    @Test
    void joinPrivateRoomCarriesBothIds() {
        ClientCommand command = decoder.decode(
                "{\"type\":\"join_private_room\",\"data\":{\"user1_id\":5,\"user2_id\":2}}");

        assertEquals(5L, command.getUser1Id());
        assertEquals(2L, command.getUser2Id());
    }

    @Test
    void malformedFramesAreRejected() {
        assertThrows(ValidationException.class, () -> decoder.decode("not json"));
        assertThrows(ValidationException.class, () -> decoder.decode("[1,2]"));
        ValidationException unknown = assertThrows(ValidationException.class,
                () -> decoder.decode("{\"type\":\"drop_tables\"}"));
        assertEquals("Unknown event: drop_tables", unknown.getMessage());
    }

    @Test
    void nonNumericIdIsRejected() {
        assertThrows(ValidationException.class,
                () -> decoder.decode("{\"type\":\"unpin_message\",\"data\":{\"message_id\":\"abc\"}}"));
    }
}
