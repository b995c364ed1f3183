package com.chattrix.websocket.push;

import com.chattrix.websocket.domain.PushSubscriptionEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RelayPushTransportTest {

    private static final String RELAY = "http://relay.local/push";

    private MockRestServiceServer server;
    private RelayPushTransport transport;

    private final PushSubscriptionEntity subscription = PushSubscriptionEntity.builder()
            .id(7L).userId(2L).endpoint("https://fcm.example/abc").p256dhKey("p-key").authKey("a-key").build();

    private final PushMessage message = PushMessage.builder()
            .title("Message from Alice").body("hi").url("/chat/1").type("private_message").build();

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        transport = new RelayPushTransport(restTemplate, RELAY);
    }

    @Test
    void postsSubscriptionAndPayload() {
        server.expect(requestTo(RELAY))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.subscription.endpoint").value("https://fcm.example/abc"))
                .andExpect(jsonPath("$.subscription.keys.p256dh").value("p-key"))
                .andExpect(jsonPath("$.payload.title").value("Message from Alice"))
                .andRespond(withSuccess("", MediaType.APPLICATION_JSON));

        assertEquals(PushResult.DELIVERED, transport.send(subscription, message));
        server.verify();
    }

    @Test
    void goneMeansExpired() {
        server.expect(requestTo(RELAY)).andRespond(withStatus(HttpStatus.GONE));

        assertEquals(PushResult.EXPIRED, transport.send(subscription, message));
    }

    @Test
    void notFoundMeansExpired() {
        server.expect(requestTo(RELAY)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertEquals(PushResult.EXPIRED, transport.send(subscription, message));
    }

    @Test
    void otherFailuresAreTransient() {
        server.expect(requestTo(RELAY)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertEquals(PushResult.TRANSIENT_ERROR, transport.send(subscription, message));
    }
}
