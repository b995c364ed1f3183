package com.chattrix.websocket.storage;

import com.chattrix.websocket.domain.ChatMessageEntity;
import com.chattrix.websocket.domain.ConversationEntity;
import com.chattrix.websocket.domain.PushSubscriptionEntity;
import com.chattrix.websocket.domain.UserAccount;
import com.chattrix.websocket.exception.StorageException;
import com.chattrix.websocket.repository.ChatMessageRepository;
import com.chattrix.websocket.repository.ConversationRepository;
import com.chattrix.websocket.repository.PushSubscriptionRepository;
import com.chattrix.websocket.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JPA implementation of {@link ChatStorage}.
 *
 * Spring Data failures are translated to {@link StorageException} so the
 * routing layer only deals with one persistence error type.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JpaChatStorage implements ChatStorage {

    private final ChatMessageRepository messageRepository;
    private final ConversationRepository conversationRepository;
    private final PushSubscriptionRepository subscriptionRepository;
    private final UserAccountRepository userRepository;

    @Override
    @Transactional
    public ChatMessageEntity createMessage(ChatMessageEntity message) {
        return execute("createMessage", () -> {
            ChatMessageEntity saved = messageRepository.save(message);
            log.debug("Message persisted: id={}, senderId={}, private={}",
                    saved.getId(), saved.getSenderId(), saved.isPrivateMessage());
            return saved;
        });
    }

    @Override
    @Transactional
    public ChatMessageEntity createPrivateMessage(ChatMessageEntity message) {
        ChatMessageEntity saved = createMessage(message);
        Long conversationId = findOrCreateConversation(saved.getSenderId(), saved.getRecipientId());
        updateConversationLastMessage(conversationId, saved.getId(), saved.getTimestamp());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ChatMessageEntity> getMessage(Long messageId) {
        return execute("getMessage", () -> messageRepository.findById(messageId));
    }

    @Override
    @Transactional
    public boolean setPinned(Long messageId, boolean pinned) {
        return execute("setPinned", () -> messageRepository.updatePinned(messageId, pinned) > 0);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChatMessageEntity> listPinnedMessages() {
        return execute("listPinnedMessages", messageRepository::findPinnedPublic);
    }

    @Override
    @Transactional
    public Long findOrCreateConversation(Long userA, Long userB) {
        long first = Math.min(userA, userB);
        long second = Math.max(userA, userB);

        return execute("findOrCreateConversation", () -> conversationRepository
                .findByUser1IdAndUser2Id(first, second)
                .orElseGet(() -> {
                    ConversationEntity created = conversationRepository.save(ConversationEntity.builder()
                            .user1Id(first)
                            .user2Id(second)
                            .updatedAt(Instant.now())
                            .build());
                    log.info("Conversation created: id={}, users=({}, {})", created.getId(), first, second);
                    return created;
                })
                .getId());
    }

    @Override
    @Transactional
    public void updateConversationLastMessage(Long conversationId, Long messageId, Instant timestamp) {
        execute("updateConversationLastMessage", () -> {
            ConversationEntity conversation = conversationRepository.findById(conversationId)
                    .orElseThrow(() -> new StorageException("Conversation not found: " + conversationId));
            conversation.setLastMessageId(messageId);
            conversation.setUpdatedAt(timestamp != null ? timestamp : Instant.now());
            return conversationRepository.save(conversation);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserAccount> findUser(Long userId) {
        return execute("findUser", () -> userRepository.findById(userId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<PushSubscriptionEntity> listSubscriptions(Long userId) {
        return execute("listSubscriptions", () -> subscriptionRepository.findByUserId(userId));
    }

    @Override
    @Transactional
    public PushSubscriptionEntity saveSubscription(Long userId, String endpoint, String p256dhKey, String authKey) {
        return execute("saveSubscription", () -> {
            PushSubscriptionEntity subscription = subscriptionRepository.findByEndpoint(endpoint)
                    .orElseGet(() -> PushSubscriptionEntity.builder().endpoint(endpoint).build());
            subscription.setUserId(userId);
            subscription.setP256dhKey(p256dhKey);
            subscription.setAuthKey(authKey);
            subscription.setCreatedAt(Instant.now());
            return subscriptionRepository.save(subscription);
        });
    }

    @Override
    @Transactional
    public void deleteSubscription(Long subscriptionId) {
        execute("deleteSubscription", () -> {
            subscriptionRepository.deleteById(subscriptionId);
            return null;
        });
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Storage operation failed: operation={}", operation, e);
            throw new StorageException("Storage operation failed: " + operation, e);
        }
    }
}
