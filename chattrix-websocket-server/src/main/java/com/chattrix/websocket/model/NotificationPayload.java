package com.chattrix.websocket.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationPayload {
    private String type;

    private String title;

    private String message;

    private String sender;

    @JsonProperty("chat_url")
    private String chatUrl;

    @JsonProperty("sender_id")
    private Long senderId;
}
