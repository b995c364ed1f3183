package com.chattrix.websocket.service;

import com.chattrix.websocket.domain.ChatMessageEntity;
import com.chattrix.websocket.domain.ClientCommand;
import com.chattrix.websocket.domain.EventNames;
import com.chattrix.websocket.domain.NotificationRequest;
import com.chattrix.websocket.domain.NotificationRequest.NotificationType;
import com.chattrix.websocket.domain.ServerEvent;
import com.chattrix.websocket.domain.UserProfile;
import com.chattrix.websocket.domain.ViewLocation;
import com.chattrix.websocket.exception.AuthorizationException;
import com.chattrix.websocket.exception.ChatEventException;
import com.chattrix.websocket.exception.NotFoundException;
import com.chattrix.websocket.exception.StorageException;
import com.chattrix.websocket.exception.ValidationException;
import com.chattrix.websocket.infrastructure.ClientConnection;
import com.chattrix.websocket.infrastructure.ConnectionRegistry;
import com.chattrix.websocket.infrastructure.ConversationLocks;
import com.chattrix.websocket.infrastructure.KeyedSerialExecutor;
import com.chattrix.websocket.infrastructure.LocationTracker;
import com.chattrix.websocket.infrastructure.RoomManager;
import com.chattrix.websocket.model.MessagePayload;
import com.chattrix.websocket.model.TypingPayload;
import com.chattrix.websocket.storage.ChatStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Central dispatcher for client commands.
 *
 * Commands from one user run in acceptance order on that user's serial lane.
 * Every failure ends at {@link #handle}: the issuer gets an {@code error} event,
 * nobody else sees anything, and in-memory state is left as it was.
 */
@Service
@Slf4j
public class MessageRouter {

    static final String PUBLIC_TITLE = "New message in Public Chat";
    static final String PUBLIC_CHAT_URL = "/chat";
    static final String GENERIC_ERROR = "Something went wrong, please try again";

    private final ConnectionRegistry connectionRegistry;
    private final RoomManager roomManager;
    private final LocationTracker locationTracker;
    private final NotificationDispatcher notificationDispatcher;
    private final ChatStorage chatStorage;
    private final UserDirectory userDirectory;
    private final ConversationLocks conversationLocks;
    private final KeyedSerialExecutor serialExecutor;
    private final MetricsService metricsService;
    private final Optional<EventPublisher> eventPublisher;
    private final int publicPreviewLength;
    private final int privatePreviewLength;

    public MessageRouter(
            ConnectionRegistry connectionRegistry,
            RoomManager roomManager,
            LocationTracker locationTracker,
            NotificationDispatcher notificationDispatcher,
            ChatStorage chatStorage,
            UserDirectory userDirectory,
            ConversationLocks conversationLocks,
            KeyedSerialExecutor serialExecutor,
            MetricsService metricsService,
            Optional<EventPublisher> eventPublisher,
            @Value("${chat.notifications.public-preview-length:50}") int publicPreviewLength,
            @Value("${chat.notifications.private-preview-length:100}") int privatePreviewLength) {
        this.connectionRegistry = connectionRegistry;
        this.roomManager = roomManager;
        this.locationTracker = locationTracker;
        this.notificationDispatcher = notificationDispatcher;
        this.chatStorage = chatStorage;
        this.userDirectory = userDirectory;
        this.conversationLocks = conversationLocks;
        this.serialExecutor = serialExecutor;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
        this.publicPreviewLength = publicPreviewLength;
        this.privatePreviewLength = privatePreviewLength;
    }

    // ===== Presence lifecycle =====

    public void onConnect(ClientConnection connection) {
        Long userId = connection.getUserId();

        connectionRegistry.register(connection).ifPresent(roomManager::leaveAll);
        roomManager.join(RoomManager.personalRoomId(userId), connection);
        locationTracker.setLocation(userId, ViewLocation.unknown());

        metricsService.recordConnection(userId, true);
        eventPublisher.ifPresent(publisher -> publisher.publishUserConnected(userId));
        broadcastPresence();
    }

    public void onDisconnect(ClientConnection connection) {
        Long userId = connection.getUserId();
        roomManager.leaveAll(connection);

        if (!connectionRegistry.unregister(connection)) {
            // a newer connection owns the user's presence and location
            return;
        }

        locationTracker.clear(userId);
        metricsService.recordDisconnection(userId);
        eventPublisher.ifPresent(publisher -> publisher.publishUserDisconnected(userId));
        broadcastPresence();

        // runs after whatever was still queued on the user's lane
        serialExecutor.submit(userId, () -> release(connection));
    }

    private void release(ClientConnection connection) {
        roomManager.leaveAll(connection);
        if (!connectionRegistry.isOnline(connection.getUserId())) {
            locationTracker.clear(connection.getUserId());
        }
    }

    private boolean isCurrent(ClientConnection connection) {
        return connection.isOpen()
                && connectionRegistry.get(connection.getUserId()).filter(connection::equals).isPresent();
    }

    // ===== Command dispatch =====

    /**
     * Queues a command on the issuer's serial lane.
     */
    public CompletableFuture<Void> accept(ClientConnection connection, ClientCommand command) {
        connection.touch();
        metricsService.recordEventReceived(command.getType().name());
        return serialExecutor.submit(connection.getUserId(), () -> handle(connection, command));
    }

    void handle(ClientConnection connection, ClientCommand command) {
        if (!isCurrent(connection)) {
            log.debug("Dropped {} from a closed connection: userId={}", command.getEventName(), connection.getUserId());
            return;
        }
        try {
            switch (command.getType()) {
                case SEND_PUBLIC_MESSAGE:
                    sendPublicMessage(connection, command);
                    break;
                case SEND_PRIVATE_MESSAGE:
                    sendPrivateMessage(connection, command);
                    break;
                case PIN_MESSAGE:
                    pinMessage(connection, command);
                    break;
                case UNPIN_MESSAGE:
                    unpinMessage(connection, command);
                    break;
                case TYPING:
                    relayTyping(connection, command);
                    break;
                case USER_LOCATION:
                    locationTracker.setLocation(connection.getUserId(), command.getLocation());
                    break;
                case JOIN_USER_ROOM:
                    joinUserRoom(connection);
                    break;
                case JOIN_PRIVATE_ROOM:
                    joinPrivateRoom(connection, command);
                    break;
                case GET_ONLINE_USERS:
                    roomManager.sendTo(connection, ServerEvent.of(EventNames.ONLINE_USERS, connectionRegistry.snapshot()));
                    break;
                case USER_JOINED:
                    announceJoin(connection);
                    break;
                case HEARTBEAT:
                    roomManager.sendTo(connection, ServerEvent.of(EventNames.HEARTBEAT_RESPONSE,
                            Map.of("timestamp", Instant.now().toString())));
                    break;
                default:
                    log.warn("Unhandled command: type={}", command.getType());
            }

        } catch (StorageException e) {
            log.error("Storage failure handling {}: userId={}", command.getEventName(), connection.getUserId(), e);
            metricsService.recordError("STORAGE", "MessageRouter");
            roomManager.sendTo(connection, ServerEvent.error(StorageException.CLIENT_MESSAGE));

        } catch (ChatEventException e) {
            log.info("Rejected {}: userId={}, reason={}", command.getEventName(), connection.getUserId(), e.getMessage());
            roomManager.sendTo(connection, ServerEvent.error(e.getMessage()));

        } catch (RuntimeException e) {
            log.error("Unexpected failure handling {}: userId={}", command.getEventName(), connection.getUserId(), e);
            metricsService.recordError(e.getClass().getSimpleName(), "MessageRouter");
            roomManager.sendTo(connection, ServerEvent.error(GENERIC_ERROR));
        }
    }

    // ===== Messages =====

    private void sendPublicMessage(ClientConnection connection, ClientCommand command) {
        String text = trimmed(command.getText());
        if (text.isEmpty()) {
            log.debug("Empty public message dropped: userId={}", connection.getUserId());
            return;
        }

        UserProfile sender = connection.getProfile();
        ChatMessageEntity saved = chatStorage.createMessage(ChatMessageEntity.builder()
                .senderId(sender.getId())
                .text(text)
                .privateMessage(false)
                .build());
        metricsService.recordMessagePersisted(false);

        roomManager.broadcastAll(ServerEvent.of(EventNames.RECEIVE_MESSAGE, MessagePayload.of(saved, sender)));
        eventPublisher.ifPresent(publisher -> publisher.publishMessageSent(saved));

        String body = sender.getName() + ": " + NotificationDispatcher.preview(text, publicPreviewLength);
        int notified = 0;
        for (ClientConnection other : connectionRegistry.connections()) {
            Long userId = other.getUserId();
            if (userId.equals(sender.getId()) || locationTracker.isViewingPublic(userId)) {
                continue;
            }
            notificationDispatcher.notify(NotificationRequest.builder()
                    .recipientId(userId)
                    .type(NotificationType.PUBLIC_MESSAGE)
                    .title(PUBLIC_TITLE)
                    .body(body)
                    .sender(sender.getName())
                    .chatUrl(PUBLIC_CHAT_URL)
                    .build());
            notified++;
        }

        log.info("Public message routed: messageId={}, senderId={}, notified={}",
                saved.getId(), sender.getId(), notified);
    }

    private void sendPrivateMessage(ClientConnection connection, ClientCommand command) {
        Long recipientId = command.getRecipientId();
        String text = trimmed(command.getText());
        if (recipientId == null || text.isEmpty()) {
            throw new ValidationException("Missing recipient or message");
        }

        UserProfile sender = connection.getProfile();
        Long senderId = sender.getId();
        userDirectory.find(recipientId)
                .orElseThrow(() -> new NotFoundException("Recipient not found"));

        ChatMessageEntity saved = conversationLocks.withPairLock(senderId, recipientId, () ->
                chatStorage.createPrivateMessage(ChatMessageEntity.builder()
                        .senderId(senderId)
                        .recipientId(recipientId)
                        .text(text)
                        .privateMessage(true)
                        .build()));
        metricsService.recordMessagePersisted(true);

        ServerEvent event = ServerEvent.of(EventNames.RECEIVE_PRIVATE_MESSAGE, MessagePayload.of(saved, sender));
        roomManager.broadcast(RoomManager.personalRoomId(senderId), event);
        eventPublisher.ifPresent(publisher -> publisher.publishMessageSent(saved));

        if (recipientId.equals(senderId)) {
            log.info("Private note saved: messageId={}, userId={}", saved.getId(), senderId);
            return;
        }

        roomManager.broadcast(RoomManager.personalRoomId(recipientId), event);

        boolean viewing = locationTracker.isViewingPrivateWith(recipientId, senderId);
        if (!viewing) {
            notificationDispatcher.notify(NotificationRequest.builder()
                    .recipientId(recipientId)
                    .type(NotificationType.PRIVATE_MESSAGE)
                    .title("Message from " + sender.getName())
                    .body(NotificationDispatcher.preview(text, privatePreviewLength))
                    .sender(sender.getName())
                    .senderId(senderId)
                    .chatUrl(PUBLIC_CHAT_URL + "/" + senderId)
                    .build());
        }

        log.info("Private message routed: messageId={}, senderId={}, recipientId={}, notified={}",
                saved.getId(), senderId, recipientId, !viewing);
    }

    // ===== Pinning =====

    private void pinMessage(ClientConnection connection, ClientCommand command) {
        requireAdmin(connection);
        Long messageId = requireMessageId(command);

        chatStorage.getMessage(messageId)
                .filter(ChatMessageEntity::isPublic)
                .orElseThrow(() -> new NotFoundException("Message not found or is private"));

        if (!chatStorage.setPinned(messageId, true)) {
            throw new NotFoundException("Message not found or is private");
        }

        roomManager.broadcastAll(ServerEvent.of(EventNames.UPDATE_PINNED, Map.of("message_id", messageId)));
        roomManager.sendTo(connection, ServerEvent.success("Message pinned successfully"));
        eventPublisher.ifPresent(publisher -> publisher.publishPinChanged(messageId, connection.getUserId(), true));
        log.info("Message pinned: messageId={}, adminId={}", messageId, connection.getUserId());
    }

    private void unpinMessage(ClientConnection connection, ClientCommand command) {
        requireAdmin(connection);
        Long messageId = requireMessageId(command);

        if (!chatStorage.setPinned(messageId, false)) {
            throw new NotFoundException("Message not found");
        }

        roomManager.broadcastAll(ServerEvent.of(EventNames.UPDATE_UNPINNED, Map.of("message_id", messageId)));
        roomManager.sendTo(connection, ServerEvent.success("Message unpinned successfully"));
        eventPublisher.ifPresent(publisher -> publisher.publishPinChanged(messageId, connection.getUserId(), false));
        log.info("Message unpinned: messageId={}, adminId={}", messageId, connection.getUserId());
    }

    private void requireAdmin(ClientConnection connection) {
        if (!connection.getProfile().isAdmin()) {
            throw new AuthorizationException("Admin access required");
        }
    }

    private Long requireMessageId(ClientCommand command) {
        if (command.getMessageId() == null) {
            throw new ValidationException("Message ID required");
        }
        return command.getMessageId();
    }

    // ===== Ephemeral events =====

    private void relayTyping(ClientConnection connection, ClientCommand command) {
        UserProfile profile = connection.getProfile();
        String chatType = command.getChatType() != null ? command.getChatType() : "public";

        ServerEvent event = ServerEvent.of(EventNames.USER_TYPING, TypingPayload.builder()
                .userId(profile.getId())
                .username(profile.getUsername())
                .displayName(profile.getDisplayName())
                .isTyping(command.isTyping())
                .chatType(chatType)
                .build());

        if ("private".equals(chatType) && command.getRecipientId() != null) {
            roomManager.broadcast(RoomManager.personalRoomId(command.getRecipientId()), event);
        } else {
            roomManager.broadcastAllExcept(event, profile.getId());
        }
    }

    private void joinUserRoom(ClientConnection connection) {
        roomManager.join(RoomManager.personalRoomId(connection.getUserId()), connection);
        userDirectory.refresh(connection.getUserId()).ifPresent(connection::setProfile);
        broadcastPresence();
    }

    private void joinPrivateRoom(ClientConnection connection, ClientCommand command) {
        Long first = command.getUser1Id();
        Long second = command.getUser2Id();
        if (first == null || second == null) {
            throw new ValidationException("Both user ids are required");
        }
        Long userId = connection.getUserId();
        if (!userId.equals(first) && !userId.equals(second)) {
            throw new AuthorizationException("Not a participant of this conversation");
        }

        String roomId = RoomManager.pairRoomId(first, second);
        roomManager.join(roomId, connection);
        log.debug("Joined private room: userId={}, roomId={}", userId, roomId);
    }

    private void announceJoin(ClientConnection connection) {
        String text = connection.getProfile().getName() + " has joined the chat.";
        roomManager.broadcastAll(ServerEvent.of(EventNames.RECEIVE_MESSAGE, MessagePayload.systemAnnouncement(text)));
    }

    private void broadcastPresence() {
        roomManager.broadcastAll(ServerEvent.of(EventNames.ONLINE_USERS, connectionRegistry.snapshot()));
        metricsService.recordOnlineUsers(connectionRegistry.size());
    }

    private static String trimmed(String text) {
        return text == null ? "" : text.trim();
    }
}
