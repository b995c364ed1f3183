package com.chattrix.websocket.service;

import com.chattrix.websocket.config.RealtimeConfig;
import com.chattrix.websocket.domain.EventNames;
import com.chattrix.websocket.domain.NotificationRequest;
import com.chattrix.websocket.domain.NotificationRequest.NotificationType;
import com.chattrix.websocket.domain.PushSubscriptionEntity;
import com.chattrix.websocket.domain.ServerEvent;
import com.chattrix.websocket.domain.UserProfile;
import com.chattrix.websocket.exception.StorageException;
import com.chattrix.websocket.infrastructure.RoomManager;
import com.chattrix.websocket.model.NotificationPayload;
import com.chattrix.websocket.push.PushMessage;
import com.chattrix.websocket.push.PushResult;
import com.chattrix.websocket.push.PushTransport;
import com.chattrix.websocket.storage.ChatStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Sends a notification over both channels: an in-band {@code notification}
 * event to the user's personal room, and a push to every stored subscription.
 *
 * The two channels are independent. A failing push never affects the in-band
 * event or the user's other subscriptions.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private static final String ELLIPSIS = "...";
    private static final String PUSH_ICON = "/static/profile_pics/" + UserProfile.DEFAULT_PICTURE;

    private final RoomManager roomManager;
    private final ChatStorage chatStorage;
    private final PushTransport pushTransport;
    private final Executor pushExecutor;
    private final MetricsService metricsService;
    private final int maxBodyLength;

    public NotificationDispatcher(
            RoomManager roomManager,
            ChatStorage chatStorage,
            PushTransport pushTransport,
            @Qualifier(RealtimeConfig.PUSH_EXECUTOR) Executor pushExecutor,
            MetricsService metricsService,
            @Value("${chat.notifications.max-body-length:120}") int maxBodyLength) {
        this.roomManager = roomManager;
        this.chatStorage = chatStorage;
        this.pushTransport = pushTransport;
        this.pushExecutor = pushExecutor;
        this.metricsService = metricsService;
        this.maxBodyLength = maxBodyLength;
    }

    public void notify(Long userId, NotificationType kind, String title, String body, String deepLink) {
        notify(NotificationRequest.builder()
                .recipientId(userId)
                .type(kind)
                .title(title)
                .body(body)
                .chatUrl(deepLink)
                .build());
    }

    public void notify(NotificationRequest request) {
        String body = preview(request.getBody(), maxBodyLength);

        NotificationPayload payload = NotificationPayload.builder()
                .type(request.getType().wireName())
                .title(request.getTitle())
                .message(body)
                .sender(request.getSender())
                .chatUrl(request.getChatUrl())
                .senderId(request.getSenderId())
                .build();

        int delivered = roomManager.broadcast(
                RoomManager.personalRoomId(request.getRecipientId()),
                ServerEvent.of(EventNames.NOTIFICATION, payload));
        metricsService.recordNotification(request.getType().wireName());
        log.debug("In-band notification: userId={}, type={}, delivered={}",
                request.getRecipientId(), request.getType().wireName(), delivered);

        PushMessage message = PushMessage.builder()
                .title(request.getTitle())
                .body(body)
                .url(request.getChatUrl())
                .icon(PUSH_ICON)
                .type(request.getType().wireName())
                .build();

        try {
            pushExecutor.execute(() -> sendPush(request.getRecipientId(), message));
        } catch (RejectedExecutionException e) {
            log.warn("Push skipped, executor saturated: userId={}", request.getRecipientId());
            metricsService.recordPushResult(PushResult.TRANSIENT_ERROR.name());
        }
    }

    void sendPush(Long userId, PushMessage message) {
        List<PushSubscriptionEntity> subscriptions;
        try {
            subscriptions = chatStorage.listSubscriptions(userId);
        } catch (StorageException e) {
            log.error("Could not load push subscriptions: userId={}", userId, e);
            return;
        }

        if (subscriptions.isEmpty()) {
            log.debug("No push subscriptions for user {}", userId);
            return;
        }

        for (PushSubscriptionEntity subscription : subscriptions) {
            PushResult result = deliver(subscription, message);
            metricsService.recordPushResult(result.name());

            switch (result) {
                case DELIVERED:
                    log.debug("Push delivered: userId={}, subscriptionId={}", userId, subscription.getId());
                    break;
                case EXPIRED:
                    removeExpired(userId, subscription);
                    break;
                default:
                    log.warn("Push failed: userId={}, subscriptionId={}", userId, subscription.getId());
                    break;
            }
        }
    }

    private PushResult deliver(PushSubscriptionEntity subscription, PushMessage message) {
        try {
            return pushTransport.send(subscription, message);
        } catch (RuntimeException e) {
            log.error("Push transport error: subscriptionId={}", subscription.getId(), e);
            return PushResult.TRANSIENT_ERROR;
        }
    }

    private void removeExpired(Long userId, PushSubscriptionEntity subscription) {
        try {
            chatStorage.deleteSubscription(subscription.getId());
            log.info("Removed expired push subscription: userId={}, subscriptionId={}",
                    userId, subscription.getId());
        } catch (StorageException e) {
            log.error("Could not remove expired subscription: subscriptionId={}", subscription.getId(), e);
        }
    }

    /**
     * Cuts {@code text} to {@code limit} characters, marking the cut with an ellipsis.
     */
    public static String preview(String text, int limit) {
        if (text == null) {
            return "";
        }
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit) + ELLIPSIS;
    }
}
