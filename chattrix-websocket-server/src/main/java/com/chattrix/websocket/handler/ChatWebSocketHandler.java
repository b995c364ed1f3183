package com.chattrix.websocket.handler;

import com.chattrix.websocket.domain.ClientCommand;
import com.chattrix.websocket.domain.ServerEvent;
import com.chattrix.websocket.domain.UserProfile;
import com.chattrix.websocket.exception.ChatEventException;
import com.chattrix.websocket.infrastructure.ClientConnection;
import com.chattrix.websocket.service.MessageRouter;
import com.chattrix.websocket.service.MetricsService;
import com.chattrix.websocket.service.SecurityValidator;
import com.chattrix.websocket.service.UserDirectory;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.Optional;

/**
 * Socket entry point at {@code /ws/chat}.
 *
 * Authenticates the handshake, binds the socket to a {@link ClientConnection}
 * and hands decoded frames to the {@link MessageRouter}.
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ATTRIBUTE = "chat.connection";

    private static final int SEND_TIME_LIMIT_MS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final ClientEventDecoder eventDecoder;
    private final MessageRouter messageRouter;
    private final UserDirectory userDirectory;
    private final SecurityValidator securityValidator;
    private final MetricsService metricsService;

    public ChatWebSocketHandler(ObjectMapper objectMapper,
                                ClientEventDecoder eventDecoder,
                                MessageRouter messageRouter,
                                UserDirectory userDirectory,
                                SecurityValidator securityValidator,
                                MetricsService metricsService) {
        this.objectMapper = objectMapper;
        this.eventDecoder = eventDecoder;
        this.messageRouter = messageRouter;
        this.userDirectory = userDirectory;
        this.securityValidator = securityValidator;
        this.metricsService = metricsService;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession wsSession) throws Exception {
        Optional<Long> userId = securityValidator.authenticate(extractToken(wsSession));
        if (userId.isEmpty()) {
            log.warn("Rejected unauthenticated connection: wsId={}", wsSession.getId());
            reject(wsSession, "Authentication failed");
            return;
        }

        Optional<UserProfile> profile;
        try {
            profile = userDirectory.find(userId.get());
        } catch (ChatEventException e) {
            log.error("Could not load profile: userId={}", userId.get(), e);
            metricsService.recordError("CONNECTION_ERROR", "WebSocketHandler");
            sendError(wsSession, "Connection failed");
            wsSession.close(CloseStatus.SERVER_ERROR);
            return;
        }

        if (profile.isEmpty()) {
            log.warn("Rejected connection for unknown user: userId={}", userId.get());
            reject(wsSession, "Unknown user");
            return;
        }

        WebSocketSession concurrentSession = new ConcurrentWebSocketSessionDecorator(
                wsSession, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES);
        ClientConnection connection = new ClientConnection(userId.get(), concurrentSession, profile.get());
        wsSession.getAttributes().put(CONNECTION_ATTRIBUTE, connection);

        messageRouter.onConnect(connection);
        log.info("WebSocket connected: wsId={}, userId={}", wsSession.getId(), userId.get());
    }

    @Override
    protected void handleTextMessage(WebSocketSession wsSession, TextMessage message) {
        ClientConnection connection = connectionOf(wsSession);
        if (connection == null) {
            log.warn("Frame on unbound socket ignored: wsId={}", wsSession.getId());
            return;
        }

        ClientCommand command;
        try {
            command = eventDecoder.decode(message.getPayload());
        } catch (ChatEventException e) {
            log.debug("Undecodable frame from userId={}: {}", connection.getUserId(), e.getMessage());
            connection.touch();
            sendError(connection.getWsSession(), e.getMessage());
            return;
        }

        log.debug("Received {} from userId={}", command.getEventName(), connection.getUserId());
        messageRouter.accept(connection, command);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession wsSession, CloseStatus status) {
        ClientConnection connection = connectionOf(wsSession);
        if (connection == null) {
            return;
        }
        wsSession.getAttributes().remove(CONNECTION_ATTRIBUTE);

        log.info("WebSocket closed: wsId={}, userId={}, status={}",
                wsSession.getId(), connection.getUserId(), status);
        messageRouter.onDisconnect(connection);
    }

    @Override
    public void handleTransportError(WebSocketSession wsSession, Throwable exception) {
        ClientConnection connection = connectionOf(wsSession);
        log.error("WebSocket transport error: wsId={}, userId={}",
                wsSession.getId(), connection != null ? connection.getUserId() : null, exception);
        metricsService.recordError("TRANSPORT_ERROR", "WebSocketHandler");
    }

    // Helper methods

    private ClientConnection connectionOf(WebSocketSession wsSession) {
        Object attribute = wsSession.getAttributes().get(CONNECTION_ATTRIBUTE);
        return attribute instanceof ClientConnection ? (ClientConnection) attribute : null;
    }

    private void reject(WebSocketSession wsSession, String reason) throws IOException {
        metricsService.recordConnection(null, false);
        sendError(wsSession, reason);
        wsSession.close(CloseStatus.NOT_ACCEPTABLE);
    }

    private void sendError(WebSocketSession wsSession, String error) {
        try {
            wsSession.sendMessage(new TextMessage(objectMapper.writeValueAsString(ServerEvent.error(error))));
        } catch (IOException e) {
            log.error("Error sending error message: {}", e.getMessage());
        }
    }

    /**
     * Token from {@code ?token=} or the {@code Authorization} header.
     */
    private String extractToken(WebSocketSession session) {
        URI uri = session.getUri();
        if (uri != null) {
            String token = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("token");
            if (token != null && !token.isBlank()) {
                return token;
            }
        }
        return session.getHandshakeHeaders().getFirst(HttpHeaders.AUTHORIZATION);
    }
}
