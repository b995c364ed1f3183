package com.chattrix.websocket.service;

import com.chattrix.websocket.domain.ChatMessageEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes chat domain events to Kafka (optional).
 *
 * Enable with: KAFKA_ENABLED=true
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true", matchIfMissing = false)
public class EventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MetricsService metricsService;

    @Value("${kafka.topics.chat-events:chat-events}")
    private String chatEventsTopic;

    public EventPublisher(KafkaTemplate<String, Object> kafkaTemplate, MetricsService metricsService) {
        this.kafkaTemplate = kafkaTemplate;
        this.metricsService = metricsService;
    }

    public void publishMessageSent(ChatMessageEntity message) {
        Map<String, Object> event = baseEvent("MESSAGE_SENT");
        event.put("messageId", message.getId());
        event.put("senderId", message.getSenderId());
        event.put("recipientId", message.getRecipientId());
        event.put("private", message.isPrivateMessage());
        event.put("contentLength", message.getText() != null ? message.getText().length() : 0);

        publishEvent(String.valueOf(message.getSenderId()), event, "MESSAGE_SENT");
    }

    public void publishPinChanged(Long messageId, Long actorId, boolean pinned) {
        String eventType = pinned ? "MESSAGE_PINNED" : "MESSAGE_UNPINNED";
        Map<String, Object> event = baseEvent(eventType);
        event.put("messageId", messageId);
        event.put("actorId", actorId);

        publishEvent(String.valueOf(messageId), event, eventType);
    }

    public void publishUserConnected(Long userId) {
        Map<String, Object> event = baseEvent("USER_CONNECTED");
        event.put("userId", userId);
        publishEvent(String.valueOf(userId), event, "USER_CONNECTED");
    }

    public void publishUserDisconnected(Long userId) {
        Map<String, Object> event = baseEvent("USER_DISCONNECTED");
        event.put("userId", userId);
        publishEvent(String.valueOf(userId), event, "USER_DISCONNECTED");
    }

    private Map<String, Object> baseEvent(String eventType) {
        Map<String, Object> event = new HashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        return event;
    }

    /**
     * Generic event publisher
     */
    private void publishEvent(String key, Object event, String eventType) {
        try {
            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(chatEventsTopic, key, event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event published successfully: type={}, topic={}, partition={}, offset={}",
                            eventType, chatEventsTopic,
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event: type={}, topic={}", eventType, chatEventsTopic, ex);
                    metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
                }
            });

        } catch (RuntimeException e) {
            log.error("Error publishing event: type={}", eventType, e);
            metricsService.recordError("KAFKA_PUBLISH_ERROR", "EventPublisher");
        }
    }
}
