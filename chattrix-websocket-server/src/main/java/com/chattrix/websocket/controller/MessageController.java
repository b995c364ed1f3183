package com.chattrix.websocket.controller;

import com.chattrix.websocket.domain.ChatMessageEntity;
import com.chattrix.websocket.domain.UserProfile;
import com.chattrix.websocket.exception.StorageException;
import com.chattrix.websocket.model.MessagePayload;
import com.chattrix.websocket.service.SecurityValidator;
import com.chattrix.websocket.service.UserDirectory;
import com.chattrix.websocket.storage.ChatStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api/messages")
public class MessageController {

    private static final UserProfile SYSTEM_SENDER = UserProfile.builder()
            .username("system")
            .displayName("System")
            .build();

    private final ChatStorage chatStorage;
    private final UserDirectory userDirectory;
    private final SecurityValidator securityValidator;

    public MessageController(ChatStorage chatStorage,
                             UserDirectory userDirectory,
                             SecurityValidator securityValidator) {
        this.chatStorage = chatStorage;
        this.userDirectory = userDirectory;
        this.securityValidator = securityValidator;
    }

    /**
     * Pinned public messages, newest first
     * GET /api/messages/pinned
     */
    @GetMapping("/pinned")
    public ResponseEntity<List<MessagePayload>> pinned(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        if (securityValidator.authenticate(authorization).isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        try {
            List<ChatMessageEntity> messages = chatStorage.listPinnedMessages();
            return ResponseEntity.ok(messages.stream()
                    .map(message -> MessagePayload.of(message,
                            userDirectory.find(message.getSenderId()).orElse(SYSTEM_SENDER)))
                    .collect(Collectors.toList()));

        } catch (StorageException e) {
            log.error("Could not list pinned messages", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
        }
    }
}
