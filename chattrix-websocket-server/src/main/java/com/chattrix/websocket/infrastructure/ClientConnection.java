package com.chattrix.websocket.infrastructure;

import com.chattrix.websocket.domain.UserProfile;
import lombok.Getter;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.UUID;

/**
 * One live socket bound to an authenticated user.
 *
 * Equality is identity: a reconnect of the same user is a different connection.
 */
@Getter
public class ClientConnection {

    private final String connectionId;
    private final Long userId;
    private final WebSocketSession wsSession;
    private final Instant connectedAt;
    private volatile UserProfile profile;
    private volatile Instant lastSeen;

    public ClientConnection(Long userId, WebSocketSession wsSession, UserProfile profile) {
        this.connectionId = UUID.randomUUID().toString();
        this.userId = userId;
        this.wsSession = wsSession;
        this.profile = profile;
        this.connectedAt = Instant.now();
        this.lastSeen = connectedAt;
    }

    public void setProfile(UserProfile profile) {
        this.profile = profile;
    }

    public void touch() {
        this.lastSeen = Instant.now();
    }

    public boolean isOpen() {
        return wsSession.isOpen();
    }

    public void send(TextMessage message) throws IOException {
        wsSession.sendMessage(message);
    }

    public void close(CloseStatus status) throws IOException {
        if (wsSession.isOpen()) {
            wsSession.close(status);
        }
    }

    @Override
    public String toString() {
        return "ClientConnection{id=" + connectionId + ", userId=" + userId + "}";
    }
}
