package com.chattrix.websocket.model;

import com.chattrix.websocket.domain.ChatMessageEntity;
import com.chattrix.websocket.domain.UserProfile;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Message as the browser client renders it. {@code text} and {@code message}
 * carry the same body, older clients read one or the other.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessagePayload {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private Long id;

    @JsonProperty("sender_id")
    private Long senderId;

    @JsonProperty("recipient_id")
    private Long recipientId;

    private String username;

    @JsonProperty("display_name")
    private String displayName;

    private String text;

    private String message;

    private String timestamp;

    @JsonProperty("is_private")
    private Boolean isPrivate;

    private Boolean pinned;

    private Boolean system;

    @JsonProperty("profile_pic")
    private String profilePic;

    private String avatar;

    public static MessagePayload of(ChatMessageEntity message, UserProfile sender) {
        return MessagePayload.builder()
                .id(message.getId())
                .senderId(message.getSenderId())
                .recipientId(message.getRecipientId())
                .username(sender.getUsername())
                .displayName(sender.getDisplayName())
                .text(message.getText())
                .message(message.getText())
                .timestamp(formatTimestamp(message.getTimestamp()))
                .isPrivate(message.isPrivateMessage())
                .pinned(message.isPinned() ? Boolean.TRUE : null)
                .profilePic(sender.getAvatarUrl())
                .avatar(sender.getAvatarUrl())
                .build();
    }

    public static MessagePayload systemAnnouncement(String text) {
        return MessagePayload.builder()
                .system(true)
                .username("System")
                .displayName("System")
                .text(text)
                .message(text)
                .timestamp(formatTimestamp(Instant.now()))
                .profilePic("/static/profile_pics/" + UserProfile.DEFAULT_PICTURE)
                .build();
    }

    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant != null ? instant : Instant.now());
    }
}
