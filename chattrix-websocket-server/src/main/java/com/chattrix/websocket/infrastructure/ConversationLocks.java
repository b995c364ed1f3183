package com.chattrix.websocket.infrastructure;

import java.util.function.Supplier;

/**
 * Serializes writes that touch the conversation row of one user pair.
 */
public interface ConversationLocks {

    <T> T withPairLock(Long userA, Long userB, Supplier<T> action);

    static String pairKey(Long userA, Long userB) {
        return "conversation:" + Math.min(userA, userB) + ":" + Math.max(userA, userB);
    }
}
