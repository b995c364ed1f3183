package com.chattrix.websocket.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Conversation Entity - one row per unordered user pair, stored as (min, max)
 */
@Entity
@Table(name = "conversations",
    uniqueConstraints = @UniqueConstraint(name = "uk_conversation_pair", columnNames = {"user1Id", "user2Id"}),
    indexes = {
        @Index(name = "idx_conversation_user1", columnList = "user1Id,updatedAt"),
        @Index(name = "idx_conversation_user2", columnList = "user2Id,updatedAt")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationEntity implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long user1Id;

    @Column(nullable = false)
    private Long user2Id;

    private Long lastMessageId;

    @Column(nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }
}
