package com.chattrix.websocket.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRequest {

    private Long recipientId;
    private NotificationType type;
    private String title;
    private String body;
    private String sender;
    private Long senderId;
    private String chatUrl;

    public enum NotificationType {
        PUBLIC_MESSAGE("public_message"),
        PRIVATE_MESSAGE("private_message"),
        TEST("test");

        private final String wireName;

        NotificationType(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }
}
