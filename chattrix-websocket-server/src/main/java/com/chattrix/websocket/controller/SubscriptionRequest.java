package com.chattrix.websocket.controller;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/push/subscribe}, the browser's PushSubscription JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionRequest {

    private String endpoint;
    private Keys keys;

    public boolean isComplete() {
        return endpoint != null && !endpoint.isBlank()
                && keys != null && keys.getP256dh() != null && keys.getAuth() != null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Keys {
        private String p256dh;
        private String auth;
    }
}
