package com.chattrix.websocket.controller;

import com.chattrix.websocket.domain.NotificationRequest.NotificationType;
import com.chattrix.websocket.domain.PushSubscriptionEntity;
import com.chattrix.websocket.domain.UserProfile;
import com.chattrix.websocket.exception.StorageException;
import com.chattrix.websocket.service.NotificationDispatcher;
import com.chattrix.websocket.service.SecurityValidator;
import com.chattrix.websocket.service.UserDirectory;
import com.chattrix.websocket.storage.ChatStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Web Push subscription management.
 */
@Slf4j
@RestController
@RequestMapping("/api/push")
public class PushSubscriptionController {

    private final ChatStorage chatStorage;
    private final SecurityValidator securityValidator;
    private final UserDirectory userDirectory;
    private final NotificationDispatcher notificationDispatcher;

    @Value("${chat.push.vapid-public-key:}")
    private String vapidPublicKey;

    public PushSubscriptionController(ChatStorage chatStorage,
                                      SecurityValidator securityValidator,
                                      UserDirectory userDirectory,
                                      NotificationDispatcher notificationDispatcher) {
        this.chatStorage = chatStorage;
        this.securityValidator = securityValidator;
        this.userDirectory = userDirectory;
        this.notificationDispatcher = notificationDispatcher;
    }

    /**
     * Store a browser subscription
     * POST /api/push/subscribe
     */
    @PostMapping("/subscribe")
    public ResponseEntity<Map<String, Object>> subscribe(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody(required = false) SubscriptionRequest request) {
        Optional<Long> userId = securityValidator.authenticate(authorization);
        if (userId.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("success", false, "error", "Authentication required"));
        }
        if (request == null || !request.isComplete()) {
            return ResponseEntity.badRequest()
                    .body(Map.of("success", false, "error", "Invalid subscription data"));
        }

        try {
            PushSubscriptionEntity saved = chatStorage.saveSubscription(userId.get(), request.getEndpoint(),
                    request.getKeys().getP256dh(), request.getKeys().getAuth());
            log.info("Push subscription saved: userId={}, subscriptionId={}", userId.get(), saved.getId());
            return ResponseEntity.ok(Map.of("success", true, "message", "Push subscription saved"));

        } catch (StorageException e) {
            log.error("Error saving push subscription: userId={}", userId.get(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("success", false, "error", "Subscription could not be saved"));
        }
    }

    /**
     * GET /api/push/vapid-public-key
     */
    @GetMapping("/vapid-public-key")
    public Map<String, String> vapidPublicKey() {
        return Map.of("publicKey", vapidPublicKey);
    }

    /**
     * Send a test notification to a user (admin only)
     * POST /api/push/test/{userId}
     */
    @PostMapping("/test/{userId}")
    public ResponseEntity<Map<String, Object>> sendTest(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable Long userId) {
        Optional<Long> requesterId = securityValidator.authenticate(authorization);
        if (requesterId.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("success", false, "message", "Authentication required"));
        }

        boolean admin = userDirectory.find(requesterId.get()).map(UserProfile::isAdmin).orElse(false);
        if (!admin) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(Map.of("success", false, "message", "Admin access required"));
        }

        notificationDispatcher.notify(userId, NotificationType.TEST, "Test Notification",
                "This is a test push notification from Chattrix!", "/chat");
        log.info("Test notification sent: adminId={}, userId={}", requesterId.get(), userId);
        return ResponseEntity.ok(Map.of("success", true, "message", "Test notification sent to user " + userId));
    }
}
