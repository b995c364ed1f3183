package com.chattrix.websocket.infrastructure;

import com.chattrix.websocket.domain.ServerEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Room membership and the send primitives built on top of it.
 *
 * Rooms hold connection references. An empty room is removed, so a room id
 * exists only while it has members.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RoomManager {

    private static final String PERSONAL_PREFIX = "user:";
    private static final String PAIR_PREFIX = "private:";

    private final ConcurrentHashMap<String, Set<ClientConnection>> rooms = new ConcurrentHashMap<>();
    private final ConnectionRegistry connectionRegistry;
    private final ObjectMapper objectMapper;

    public static String personalRoomId(Long userId) {
        return PERSONAL_PREFIX + userId;
    }

    /**
     * Symmetric id for the private room of two users.
     */
    public static String pairRoomId(Long a, Long b) {
        long first = Math.min(a, b);
        long second = Math.max(a, b);
        return PAIR_PREFIX + first + ":" + second;
    }

    public void join(String roomId, ClientConnection connection) {
        rooms.compute(roomId, (id, members) -> {
            Set<ClientConnection> result = members != null ? members : ConcurrentHashMap.newKeySet();
            result.add(connection);
            return result;
        });
        log.debug("Joined room: roomId={}, userId={}", roomId, connection.getUserId());
    }

    public void leave(String roomId, ClientConnection connection) {
        rooms.computeIfPresent(roomId, (id, members) -> {
            members.remove(connection);
            return members.isEmpty() ? null : members;
        });
    }

    /**
     * Removes the connection from every room it belongs to.
     */
    public void leaveAll(ClientConnection connection) {
        for (String roomId : roomsOf(connection)) {
            leave(roomId, connection);
        }
    }

    public Set<ClientConnection> members(String roomId) {
        Set<ClientConnection> members = rooms.get(roomId);
        return members != null ? Set.copyOf(members) : Set.of();
    }

    public boolean isMember(String roomId, ClientConnection connection) {
        Set<ClientConnection> members = rooms.get(roomId);
        return members != null && members.contains(connection);
    }

    public Set<String> roomsOf(ClientConnection connection) {
        return rooms.entrySet().stream()
                .filter(entry -> entry.getValue().contains(connection))
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
    }

    public int roomCount() {
        return rooms.size();
    }

    /**
     * Delivers to every live member of the room. Closed members are skipped.
     *
     * @return number of connections the event was written to
     */
    public int broadcast(String roomId, ServerEvent event) {
        Set<ClientConnection> members = rooms.get(roomId);
        if (members == null || members.isEmpty()) {
            log.debug("Broadcast to empty room skipped: roomId={}, type={}", roomId, event.getType());
            return 0;
        }
        return deliver(new ArrayList<>(members), event);
    }

    public int broadcastAll(ServerEvent event) {
        return deliver(connectionRegistry.connections(), event);
    }

    public int broadcastAllExcept(ServerEvent event, Long excludedUserId) {
        List<ClientConnection> targets = connectionRegistry.connections().stream()
                .filter(connection -> !connection.getUserId().equals(excludedUserId))
                .collect(Collectors.toList());
        return deliver(targets, event);
    }

    /**
     * Sends to a single connection, typically the issuer of a command.
     */
    public boolean sendTo(ClientConnection connection, ServerEvent event) {
        TextMessage message = serialize(event);
        return message != null && write(connection, message);
    }

    private int deliver(Collection<ClientConnection> targets, ServerEvent event) {
        TextMessage message = serialize(event);
        if (message == null) {
            return 0;
        }
        int delivered = 0;
        for (ClientConnection connection : targets) {
            if (write(connection, message)) {
                delivered++;
            }
        }
        log.debug("Event delivered: type={}, recipients={}/{}", event.getType(), delivered, targets.size());
        return delivered;
    }

    private boolean write(ClientConnection connection, TextMessage message) {
        if (!connection.isOpen()) {
            return false;
        }
        try {
            connection.send(message);
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to send to connection: userId={}, connectionId={}, reason={}",
                    connection.getUserId(), connection.getConnectionId(), e.getMessage());
            return false;
        }
    }

    private TextMessage serialize(ServerEvent event) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event: type={}", event.getType(), e);
            return null;
        }
    }
}
