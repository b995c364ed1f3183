package com.chattrix.websocket.infrastructure;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process pair locks, striped by pair key.
 */
@Component
@ConditionalOnProperty(name = "chat.locks.mode", havingValue = "local", matchIfMissing = true)
public class LocalConversationLocks implements ConversationLocks {

    private static final int STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[STRIPES];

    public LocalConversationLocks() {
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public <T> T withPairLock(Long userA, Long userB, Supplier<T> action) {
        ReentrantLock lock = locks[Math.floorMod(ConversationLocks.pairKey(userA, userB).hashCode(), STRIPES)];
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
