package com.chattrix.websocket.service;

import com.chattrix.websocket.domain.UserProfile;
import com.chattrix.websocket.storage.ChatStorage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache-aside lookup of user profiles: Caffeine first, then storage.
 */
@Service
@Slf4j
public class UserDirectory {

    private final ChatStorage chatStorage;
    private final Cache<Long, UserProfile> profiles;

    public UserDirectory(
            ChatStorage chatStorage,
            @Value("${chat.users.cache-size:10000}") long cacheSize,
            @Value("${chat.users.cache-ttl-seconds:60}") long cacheTtlSeconds) {
        this.chatStorage = chatStorage;
        this.profiles = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .expireAfterWrite(Duration.ofSeconds(cacheTtlSeconds))
                .build();
    }

    public Optional<UserProfile> find(Long userId) {
        UserProfile cached = profiles.getIfPresent(userId);
        if (cached != null) {
            return Optional.of(cached);
        }
        return load(userId);
    }

    /**
     * Bypasses the cache and reloads the profile from storage.
     */
    public Optional<UserProfile> refresh(Long userId) {
        profiles.invalidate(userId);
        return load(userId);
    }

    private Optional<UserProfile> load(Long userId) {
        Optional<UserProfile> profile = chatStorage.findUser(userId).map(UserProfile::from);
        profile.ifPresent(p -> profiles.put(userId, p));
        if (profile.isEmpty()) {
            log.debug("User not found: userId={}", userId);
        }
        return profile;
    }
}
