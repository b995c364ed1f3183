package com.chattrix.websocket.infrastructure;

import com.chattrix.websocket.domain.UserProfile;
import com.chattrix.websocket.model.PresenceInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Maps each online user to their single current connection.
 *
 * A new connection for a user replaces the previous one. The replaced socket is
 * closed when {@code chat.connections.close-replaced} is set, and a later
 * disconnect of that old socket never evicts the newer entry.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    static final CloseStatus REPLACED = new CloseStatus(4000, "Replaced by a newer connection");
    static final CloseStatus STALE = CloseStatus.SESSION_NOT_RELIABLE.withReason("Connection idle");

    private final ConcurrentHashMap<Long, ClientConnection> connections = new ConcurrentHashMap<>();
    private final boolean closeReplaced;
    private final Duration staleTimeout;
    private ScheduledExecutorService sweepExecutor;

    public ConnectionRegistry(
            @Value("${chat.connections.close-replaced:true}") boolean closeReplaced,
            @Value("${chat.connections.stale-timeout-seconds:300}") long staleTimeoutSeconds) {
        this.closeReplaced = closeReplaced;
        this.staleTimeout = Duration.ofSeconds(staleTimeoutSeconds);
    }

    @PostConstruct
    public void startSweep() {
        if (staleTimeout.isZero() || staleTimeout.isNegative()) {
            log.info("Stale connection sweep disabled");
            return;
        }
        long period = Math.max(staleTimeout.getSeconds() / 2, 1);
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "connection-sweep");
            thread.setDaemon(true);
            return thread;
        });
        sweepExecutor.scheduleAtFixedRate(() -> sweepStaleConnections(Instant.now()),
                period, period, TimeUnit.SECONDS);
    }

    /**
     * Registers a connection, returning the one it replaced, if any.
     */
    public Optional<ClientConnection> register(ClientConnection connection) {
        ClientConnection previous = connections.put(connection.getUserId(), connection);

        if (previous != null && previous != connection) {
            log.info("Connection replaced: userId={}, old={}, new={}",
                    connection.getUserId(), previous.getConnectionId(), connection.getConnectionId());
            if (closeReplaced) {
                closeQuietly(previous, REPLACED);
            }
            return Optional.of(previous);
        }

        log.info("Connection registered: userId={}, connectionId={}, total={}",
                connection.getUserId(), connection.getConnectionId(), connections.size());
        return Optional.empty();
    }

    public ClientConnection register(Long userId, WebSocketSession wsSession, UserProfile profile) {
        ClientConnection connection = new ClientConnection(userId, wsSession, profile);
        register(connection);
        return connection;
    }

    /**
     * Removes whatever connection is registered for the user.
     */
    public Optional<ClientConnection> unregister(Long userId) {
        ClientConnection removed = connections.remove(userId);
        if (removed != null) {
            logRemoval(removed);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Removes the entry only if it still points at this exact connection.
     *
     * @return true when the user went offline
     */
    public boolean unregister(ClientConnection connection) {
        boolean removed = connections.remove(connection.getUserId(), connection);
        if (removed) {
            logRemoval(connection);
        } else {
            log.debug("Ignoring unregister of superseded connection: {}", connection);
        }
        return removed;
    }

    public Optional<ClientConnection> get(Long userId) {
        return Optional.ofNullable(connections.get(userId));
    }

    public boolean isOnline(Long userId) {
        return connections.containsKey(userId);
    }

    /**
     * Presence list ordered by user id.
     */
    public List<PresenceInfo> snapshot() {
        return connections.values().stream()
                .sorted(Comparator.comparing(ClientConnection::getUserId))
                .map(connection -> connection.getProfile().toPresence())
                .collect(Collectors.toList());
    }

    public Collection<ClientConnection> connections() {
        return new ArrayList<>(connections.values());
    }

    public int size() {
        return connections.size();
    }

    void sweepStaleConnections(Instant now) {
        Instant cutoff = now.minus(staleTimeout);
        for (ClientConnection connection : connections()) {
            if (connection.getLastSeen().isBefore(cutoff)) {
                log.warn("Closing stale connection: userId={}, lastSeen={}",
                        connection.getUserId(), connection.getLastSeen());
                // the socket close callback performs the normal disconnect path
                closeQuietly(connection, STALE);
            }
        }
    }

    private void logRemoval(ClientConnection connection) {
        log.info("Connection unregistered: userId={}, connectionId={}, duration={}s",
                connection.getUserId(), connection.getConnectionId(),
                Duration.between(connection.getConnectedAt(), Instant.now()).getSeconds());
    }

    private void closeQuietly(ClientConnection connection, CloseStatus status) {
        try {
            connection.close(status);
        } catch (IOException e) {
            log.warn("Failed to close connection: {}, reason={}", connection, e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        if (sweepExecutor == null) {
            return;
        }
        log.info("Shutting down ConnectionRegistry...");
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sweepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
