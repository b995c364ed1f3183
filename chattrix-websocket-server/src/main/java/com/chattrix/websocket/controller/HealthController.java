package com.chattrix.websocket.controller;

import com.chattrix.websocket.infrastructure.ConnectionRegistry;
import com.chattrix.websocket.infrastructure.RoomManager;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class HealthController {

    private final ConnectionRegistry connectionRegistry;
    private final RoomManager roomManager;
    private final ObjectProvider<RedissonClient> redissonClient;

    public HealthController(ConnectionRegistry connectionRegistry,
                            RoomManager roomManager,
                            ObjectProvider<RedissonClient> redissonClient) {
        this.connectionRegistry = connectionRegistry;
        this.roomManager = roomManager;
        this.redissonClient = redissonClient;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "healthy");
        response.put("onlineUsers", connectionRegistry.size());
        response.put("rooms", roomManager.roomCount());

        RedissonClient client = redissonClient.getIfAvailable();
        if (client != null) {
            try {
                client.getBucket("health:ping").isExists();
                response.put("redis", "connected");
            } catch (RuntimeException e) {
                log.warn("Redis health check failed: {}", e.getMessage());
                response.put("redis", "disconnected");
            }
        }

        return response;
    }
}
