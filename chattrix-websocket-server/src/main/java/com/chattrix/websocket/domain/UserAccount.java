package com.chattrix.websocket.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Registered chat user. Credentials are managed by the account service,
 * this side only reads identity and display data.
 */
@Entity
@Table(name = "chat_users", indexes = {
    @Index(name = "idx_chat_users_username", columnList = "username", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserAccount implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 80)
    private String username;

    @Column(nullable = false, length = 50)
    private String displayName;

    @Column(length = 120)
    private String profilePic;

    @Column(nullable = false)
    private boolean admin;
}
