package com.chattrix.websocket.push;

import com.chattrix.websocket.domain.PushSubscriptionEntity;
import lombok.extern.slf4j.Slf4j;

/**
 * Used when no relay is configured: records the notification and reports success.
 */
@Slf4j
public class LoggingPushTransport implements PushTransport {

    @Override
    public PushResult send(PushSubscriptionEntity subscription, PushMessage message) {
        log.info("Push (log only): subscriptionId={}, userId={}, title={}",
                subscription.getId(), subscription.getUserId(), message.getTitle());
        return PushResult.DELIVERED;
    }
}
