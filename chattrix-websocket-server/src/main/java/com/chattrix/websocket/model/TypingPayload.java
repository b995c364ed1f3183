package com.chattrix.websocket.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TypingPayload {
    @JsonProperty("user_id")
    private Long userId;

    private String username;

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("is_typing")
    private Boolean isTyping;

    @JsonProperty("chat_type")
    private String chatType; // "public" or "private"
}
