package com.chattrix.websocket.handler;

import com.chattrix.websocket.domain.ClientCommand;
import com.chattrix.websocket.domain.CommandType;
import com.chattrix.websocket.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns an inbound frame into a {@link ClientCommand}.
 *
 * Frames look like {@code {"type": "send_message", "data": {...}}}. When
 * {@code data} is a bare string it is taken as the message text. Frames
 * without {@code data} are read from the top-level object.
 */
@Component
@RequiredArgsConstructor
public class ClientEventDecoder {

    private final ObjectMapper objectMapper;

    public ClientCommand decode(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Malformed event");
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("Malformed event");
        }

        String eventName = root.path("type").asText("");
        CommandType type = CommandType.fromEventName(eventName)
                .orElseThrow(() -> new ValidationException("Unknown event: " + eventName));

        JsonNode data = root.has("data") ? root.get("data") : root;

        ClientCommand.ClientCommandBuilder command = ClientCommand.builder()
                .type(type)
                .eventName(eventName);

        if (data.isTextual()) {
            return command.text(data.asText())
                    .location(data.asText())
                    .build();
        }
        if (!data.isObject()) {
            return command.build();
        }

        return command
                .text(firstText(data, "text", "message"))
                .recipientId(longValue(data, "recipient_id"))
                .messageId(longValue(data, "message_id"))
                .location(textValue(data, "location"))
                .user1Id(longValue(data, "user1_id"))
                .user2Id(longValue(data, "user2_id"))
                .chatType(textValue(data, "chat_type"))
                .typing(booleanValue(data, "is_typing"))
                .build();
    }

    private static String firstText(JsonNode data, String... fields) {
        for (String field : fields) {
            String value = textValue(data, field);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static String textValue(JsonNode data, String field) {
        JsonNode node = data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Long longValue(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        String text = node.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid " + field);
        }
    }

    private static boolean booleanValue(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) {
            return false;
        }
        return node.isBoolean() ? node.booleanValue() : Boolean.parseBoolean(node.asText());
    }
}
