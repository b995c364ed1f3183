package com.chattrix.websocket.push;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
@Slf4j
public class PushConfig {

    @Bean
    public PushTransport pushTransport(
            RestTemplate restTemplate,
            @Value("${chat.push.relay-url:}") String relayUrl) {
        if (relayUrl == null || relayUrl.isBlank()) {
            log.info("No push relay configured, push notifications are logged only");
            return new LoggingPushTransport();
        }
        log.info("Push relay configured: {}", relayUrl);
        return new RelayPushTransport(restTemplate, relayUrl);
    }
}
