package com.chattrix.websocket.service;

import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-backed metrics.
 *
 * Counters and gauges are kept in memory and written to the log at DEBUG;
 * tagged overloads fold the tags into the metric name.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> gauges = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("✅ MetricsService initialized (log-only mode)");
    }

    // ===== Counter Metrics =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementCounter(String name, Tags tags) {
        incrementCounter(qualified(name, tags));
    }

    // ===== Gauge Metrics =====

    public void setGaugeValue(String name, int value) {
        gauges.computeIfAbsent(name, k -> new AtomicInteger(0)).set(value);
        log.debug("[METRIC] Gauge: {} = {}", name, value);
    }

    // ===== Business Metrics =====

    public void recordConnection(Long userId, boolean accepted) {
        incrementCounter("websocket.connections", Tags.of("accepted", String.valueOf(accepted)));
        log.info("📥 WebSocket connection: userId={}, accepted={}", userId, accepted);
    }

    public void recordDisconnection(Long userId) {
        incrementCounter("websocket.disconnections");
        log.info("📤 WebSocket disconnection: userId={}", userId);
    }

    public void recordAuthenticationAttempt(boolean success) {
        incrementCounter("authentication.attempts", Tags.of("success", String.valueOf(success)));
        log.debug("🔐 Auth attempt: success={}", success);
    }

    public void recordOnlineUsers(int count) {
        setGaugeValue("online_users", count);
    }

    public void recordEventReceived(String eventType) {
        incrementCounter("websocket.events.received", Tags.of("type", eventType));
    }

    public void recordMessagePersisted(boolean privateMessage) {
        incrementCounter("messages.persisted", Tags.of("private", String.valueOf(privateMessage)));
    }

    public void recordNotification(String kind) {
        incrementCounter("notifications.sent", Tags.of("kind", kind));
    }

    public void recordPushResult(String outcome) {
        incrementCounter("push.results", Tags.of("outcome", outcome));
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors", Tags.of("type", errorType, "component", component));
        log.warn("⚠️ Error: type={}, component={}", errorType, component);
    }

    // ===== Utility Methods =====

    /**
     * Current counter value, tags folded in the same way as on increment.
     */
    public long getCounterValue(String name, Tags tags) {
        return getCounterValue(qualified(name, tags));
    }

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public int getGaugeValue(String name) {
        AtomicInteger gauge = gauges.get(name);
        return gauge != null ? gauge.get() : 0;
    }

    private static String qualified(String name, Tags tags) {
        StringBuilder builder = new StringBuilder(name);
        for (Tag tag : tags) {
            builder.append('.').append(tag.getKey()).append('=').append(tag.getValue());
        }
        return builder.toString();
    }
}
