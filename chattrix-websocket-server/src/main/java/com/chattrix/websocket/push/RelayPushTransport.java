package com.chattrix.websocket.push;

import com.chattrix.websocket.domain.PushSubscriptionEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts the subscription and payload to an HTTP relay that performs the Web
 * Push encryption and delivery. The relay passes the push service status through.
 */
@Slf4j
public class RelayPushTransport implements PushTransport {

    private final RestTemplate restTemplate;
    private final String relayUrl;

    public RelayPushTransport(RestTemplate restTemplate, String relayUrl) {
        this.restTemplate = restTemplate;
        this.relayUrl = relayUrl;
    }

    @Override
    public PushResult send(PushSubscriptionEntity subscription, PushMessage message) {
        Map<String, Object> keys = new LinkedHashMap<>();
        keys.put("p256dh", subscription.getP256dhKey());
        keys.put("auth", subscription.getAuthKey());

        Map<String, Object> target = new LinkedHashMap<>();
        target.put("endpoint", subscription.getEndpoint());
        target.put("keys", keys);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("subscription", target);
        request.put("payload", message);

        try {
            restTemplate.postForEntity(relayUrl, request, Void.class);
            return PushResult.DELIVERED;

        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()
                    || e.getStatusCode().value() == HttpStatus.GONE.value()) {
                log.info("Push subscription expired: subscriptionId={}, status={}",
                        subscription.getId(), e.getStatusCode().value());
                return PushResult.EXPIRED;
            }
            log.warn("Push relay rejected notification: subscriptionId={}, status={}",
                    subscription.getId(), e.getStatusCode().value());
            return PushResult.TRANSIENT_ERROR;

        } catch (RestClientException e) {
            log.warn("Push relay unreachable: subscriptionId={}, reason={}",
                    subscription.getId(), e.getMessage());
            return PushResult.TRANSIENT_ERROR;
        }
    }
}
