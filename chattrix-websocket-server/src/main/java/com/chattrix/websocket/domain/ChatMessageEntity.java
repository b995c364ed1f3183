package com.chattrix.websocket.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persisted chat message.
 *
 * A null recipient marks a public-room message; a message with a recipient
 * is always private. Only public messages can be pinned.
 */
@Entity
@Table(name = "chat_messages", indexes = {
    @Index(name = "idx_chat_messages_sender", columnList = "senderId"),
    @Index(name = "idx_chat_messages_recipient", columnList = "recipientId"),
    @Index(name = "idx_chat_messages_pinned", columnList = "pinned,is_private")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageEntity implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long senderId;

    private Long recipientId;

    @Column(nullable = false, length = 4000)
    private String text;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(name = "is_private", nullable = false)
    private boolean privateMessage;

    @Column(nullable = false)
    private boolean pinned;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(length = 255)
    private String attachmentPath;

    @Column(length = 255)
    private String attachmentName;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public boolean isPublic() {
        return recipientId == null && !privateMessage;
    }
}
