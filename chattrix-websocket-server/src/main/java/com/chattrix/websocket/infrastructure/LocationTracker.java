package com.chattrix.websocket.infrastructure;

import com.chattrix.websocket.domain.ViewLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last view each connected user reported. Used only to suppress notifications.
 */
@Component
@Slf4j
public class LocationTracker {

    private final ConcurrentHashMap<Long, ViewLocation> locations = new ConcurrentHashMap<>();

    public void setLocation(Long userId, ViewLocation location) {
        locations.put(userId, location);
        log.debug("Location updated: userId={}, location={}", userId, location.token());
    }

    public void setLocation(Long userId, String token) {
        setLocation(userId, ViewLocation.parse(token));
    }

    public Optional<ViewLocation> getLocation(Long userId) {
        return Optional.ofNullable(locations.get(userId));
    }

    public void clear(Long userId) {
        locations.remove(userId);
    }

    public boolean isViewingPublic(Long userId) {
        ViewLocation location = locations.get(userId);
        return location != null && location.isPublic();
    }

    /**
     * True only when the user has reported the private chat with {@code otherUserId}.
     */
    public boolean isViewingPrivateWith(Long userId, Long otherUserId) {
        ViewLocation location = locations.get(userId);
        return location != null && location.isPrivateWith(otherUserId);
    }
}
