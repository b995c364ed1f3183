package com.chattrix.websocket.push;

import com.chattrix.websocket.domain.PushSubscriptionEntity;

/**
 * Delivers one notification to one browser subscription.
 *
 * Implementations report failure through the result and do not throw.
 */
public interface PushTransport {

    PushResult send(PushSubscriptionEntity subscription, PushMessage message);
}
