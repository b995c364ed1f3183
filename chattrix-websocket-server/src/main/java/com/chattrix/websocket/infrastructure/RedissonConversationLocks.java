package com.chattrix.websocket.infrastructure;

import com.chattrix.websocket.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Pair locks held in Redis, for deployments that share one database between
 * several processes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "chat.locks.mode", havingValue = "redis")
public class RedissonConversationLocks implements ConversationLocks {

    private static final long WAIT_SECONDS = 5;
    private static final long LEASE_SECONDS = 30;

    private final RedissonClient redissonClient;

    @Override
    public <T> T withPairLock(Long userA, Long userB, Supplier<T> action) {
        String key = ConversationLocks.pairKey(userA, userB);
        RLock lock = redissonClient.getLock("lock:" + key);

        try {
            if (!lock.tryLock(WAIT_SECONDS, LEASE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Failed to acquire conversation lock: key={}", key);
                throw new StorageException("Conversation is busy: " + key);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while locking conversation: " + key, e);
        }

        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
