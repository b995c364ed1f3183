package com.chattrix.websocket.handler;

import com.chattrix.websocket.config.RealtimeConfig;
import com.chattrix.websocket.domain.ClientCommand;
import com.chattrix.websocket.domain.CommandType;
import com.chattrix.websocket.domain.EventNames;
import com.chattrix.websocket.domain.UserProfile;
import com.chattrix.websocket.exception.StorageException;
import com.chattrix.websocket.infrastructure.ClientConnection;
import com.chattrix.websocket.service.MessageRouter;
import com.chattrix.websocket.service.MetricsService;
import com.chattrix.websocket.service.SecurityValidator;
import com.chattrix.websocket.service.UserDirectory;
import com.chattrix.websocket.support.SocketRecorder;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;

import java.net.URI;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatWebSocketHandlerTest {

    private static final UserProfile ALICE = UserProfile.builder()
            .id(1L).username("alice").displayName("Alice").build();

    private SecurityValidator securityValidator;
    private UserDirectory userDirectory;
    private MessageRouter messageRouter;
    private ChatWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new RealtimeConfig().objectMapper();
        securityValidator = mock(SecurityValidator.class);
        userDirectory = mock(UserDirectory.class);
        messageRouter = mock(MessageRouter.class);
        handler = new ChatWebSocketHandler(objectMapper, new ClientEventDecoder(objectMapper),
                messageRouter, userDirectory, securityValidator, new MetricsService());
    }

    private SocketRecorder socketWithToken(String token) {
        return new SocketRecorder("ws-1", URI.create("ws://localhost:8080/ws/chat?token=" + token));
    }

    private ClientConnection connectAlice(SocketRecorder socket) throws Exception {
        when(securityValidator.authenticate("good")).thenReturn(Optional.of(1L));
        when(userDirectory.find(1L)).thenReturn(Optional.of(ALICE));
        handler.afterConnectionEstablished(socket.session());
        return (ClientConnection) socket.session().getAttributes().get(ChatWebSocketHandler.CONNECTION_ATTRIBUTE);
    }

    @Test
    void missingTokenIsRejected() throws Exception {
        SocketRecorder socket = new SocketRecorder("ws-1");

        handler.afterConnectionEstablished(socket.session());

        assertEquals(CloseStatus.NOT_ACCEPTABLE, socket.closeStatus());
        assertEquals("Authentication failed", socket.last(EventNames.ERROR).get("message").asText());
        verify(messageRouter, never()).onConnect(any());
    }

    @Test
    void unknownUserIsRejected() throws Exception {
        SocketRecorder socket = socketWithToken("good");
        when(securityValidator.authenticate("good")).thenReturn(Optional.of(5L));
        when(userDirectory.find(5L)).thenReturn(Optional.empty());

        handler.afterConnectionEstablished(socket.session());

        assertEquals(CloseStatus.NOT_ACCEPTABLE, socket.closeStatus());
        assertNull(socket.session().getAttributes().get(ChatWebSocketHandler.CONNECTION_ATTRIBUTE));
    }

    @Test
    void profileLoadFailureClosesWithServerError() throws Exception {
        SocketRecorder socket = socketWithToken("good");
        when(securityValidator.authenticate("good")).thenReturn(Optional.of(1L));
        when(userDirectory.find(1L)).thenThrow(new StorageException("database unavailable"));

        handler.afterConnectionEstablished(socket.session());

        assertEquals(CloseStatus.SERVER_ERROR, socket.closeStatus());
        verify(messageRouter, never()).onConnect(any());
    }

    @Test
    void authenticatedSocketIsBoundAndRegistered() throws Exception {
        SocketRecorder socket = socketWithToken("good");

        ClientConnection connection = connectAlice(socket);

        assertNotNull(connection);
        assertEquals(1L, connection.getUserId());
        assertEquals("Alice", connection.getProfile().getName());
        assertTrue(socket.isOpen());
        verify(messageRouter).onConnect(connection);
    }

    @Test
    void authorizationHeaderIsAccepted() throws Exception {
        SocketRecorder socket = new SocketRecorder("ws-1", URI.create("ws://localhost:8080/ws/chat"));
        socket.headers().set(HttpHeaders.AUTHORIZATION, "Bearer header-token");
        when(securityValidator.authenticate("Bearer header-token")).thenReturn(Optional.of(1L));
        when(userDirectory.find(1L)).thenReturn(Optional.of(ALICE));

        handler.afterConnectionEstablished(socket.session());

        verify(messageRouter).onConnect(any(ClientConnection.class));
        assertNull(socket.closeStatus());
    }

    @Test
    void framesAreDecodedAndRouted() throws Exception {
        SocketRecorder socket = socketWithToken("good");
        ClientConnection connection = connectAlice(socket);

        handler.handleTextMessage(socket.session(),
                new TextMessage("{\"type\":\"send_message\",\"data\":{\"text\":\"hello\"}}"));

        ArgumentCaptor<ClientCommand> command = ArgumentCaptor.forClass(ClientCommand.class);
        verify(messageRouter).accept(any(ClientConnection.class), command.capture());
        assertEquals(CommandType.SEND_PUBLIC_MESSAGE, command.getValue().getType());
        assertEquals("hello", command.getValue().getText());
        assertSame(connection, socket.session().getAttributes().get(ChatWebSocketHandler.CONNECTION_ATTRIBUTE));
    }

    @Test
    void undecodableFrameAnswersWithError() throws Exception {
        SocketRecorder socket = socketWithToken("good");
        connectAlice(socket);

        handler.handleTextMessage(socket.session(), new TextMessage("{\"type\":\"dance\"}"));

        assertEquals("Unknown event: dance", socket.last(EventNames.ERROR).get("message").asText());
        verify(messageRouter, never()).accept(any(), any());
        assertTrue(socket.isOpen());
    }

    @Test
    void closeUnbindsAndDisconnects() throws Exception {
        SocketRecorder socket = socketWithToken("good");
        ClientConnection connection = connectAlice(socket);

        handler.afterConnectionClosed(socket.session(), CloseStatus.NORMAL);
        handler.afterConnectionClosed(socket.session(), CloseStatus.NORMAL);

        verify(messageRouter).onDisconnect(connection);
        assertNull(socket.session().getAttributes().get(ChatWebSocketHandler.CONNECTION_ATTRIBUTE));
    }
}
