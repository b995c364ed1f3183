package com.chattrix.websocket.support;

import com.chattrix.websocket.domain.ChatMessageEntity;
import com.chattrix.websocket.domain.ConversationEntity;
import com.chattrix.websocket.domain.PushSubscriptionEntity;
import com.chattrix.websocket.domain.UserAccount;
import com.chattrix.websocket.exception.StorageException;
import com.chattrix.websocket.storage.ChatStorage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Map-backed storage double. {@link #failWrites(boolean)} makes every write throw,
 * {@link #failConversationWrites(boolean)} only the conversation step of a private message.
 */
public class InMemoryChatStorage implements ChatStorage {

    private final AtomicLong ids = new AtomicLong();
    private final Map<Long, UserAccount> users = new ConcurrentHashMap<>();
    private final Map<Long, ChatMessageEntity> messages = new ConcurrentHashMap<>();
    private final Map<String, ConversationEntity> conversations = new ConcurrentHashMap<>();
    private final Map<Long, PushSubscriptionEntity> subscriptions = new ConcurrentHashMap<>();
    private volatile boolean failWrites;
    private volatile boolean failConversationWrites;

    public UserAccount addUser(Long id, String username, String displayName, boolean admin) {
        UserAccount account = UserAccount.builder()
                .id(id)
                .username(username)
                .displayName(displayName)
                .profilePic("default.jpg")
                .admin(admin)
                .build();
        users.put(id, account);
        return account;
    }

    public void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public void failConversationWrites(boolean fail) {
        this.failConversationWrites = fail;
    }

    public List<ChatMessageEntity> messages() {
        return messages.values().stream()
                .sorted(Comparator.comparing(ChatMessageEntity::getId))
                .collect(Collectors.toList());
    }

    public List<ConversationEntity> conversations() {
        return new ArrayList<>(conversations.values());
    }

    @Override
    public ChatMessageEntity createMessage(ChatMessageEntity message) {
        checkWritable();
        message.setId(ids.incrementAndGet());
        if (message.getTimestamp() == null) {
            message.setTimestamp(Instant.now());
        }
        messages.put(message.getId(), message);
        return message;
    }

    @Override
    public synchronized ChatMessageEntity createPrivateMessage(ChatMessageEntity message) {
        ChatMessageEntity saved = createMessage(message);
        try {
            Long conversationId = findOrCreateConversation(saved.getSenderId(), saved.getRecipientId());
            updateConversationLastMessage(conversationId, saved.getId(), saved.getTimestamp());
            return saved;
        } catch (StorageException e) {
            // rolled back with the conversation update
            messages.remove(saved.getId());
            throw e;
        }
    }

    @Override
    public Optional<ChatMessageEntity> getMessage(Long messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public boolean setPinned(Long messageId, boolean pinned) {
        checkWritable();
        ChatMessageEntity message = messages.get(messageId);
        if (message == null) {
            return false;
        }
        message.setPinned(pinned);
        return true;
    }

    @Override
    public List<ChatMessageEntity> listPinnedMessages() {
        return messages.values().stream()
                .filter(message -> message.isPinned() && message.isPublic())
                .collect(Collectors.toList());
    }

    @Override
    public Long findOrCreateConversation(Long userA, Long userB) {
        checkWritable();
        if (failConversationWrites) {
            throw new StorageException("Simulated conversation write failure");
        }
        long first = Math.min(userA, userB);
        long second = Math.max(userA, userB);
        return conversations.computeIfAbsent(first + ":" + second, key -> ConversationEntity.builder()
                .id(ids.incrementAndGet())
                .user1Id(first)
                .user2Id(second)
                .updatedAt(Instant.now())
                .build()).getId();
    }

    @Override
    public void updateConversationLastMessage(Long conversationId, Long messageId, Instant timestamp) {
        checkWritable();
        ConversationEntity conversation = conversations.values().stream()
                .filter(c -> c.getId().equals(conversationId))
                .findFirst()
                .orElseThrow(() -> new StorageException("Conversation not found: " + conversationId));
        conversation.setLastMessageId(messageId);
        conversation.setUpdatedAt(timestamp);
    }

    @Override
    public Optional<UserAccount> findUser(Long userId) {
        return Optional.ofNullable(users.get(userId));
    }

    @Override
    public List<PushSubscriptionEntity> listSubscriptions(Long userId) {
        return subscriptions.values().stream()
                .filter(subscription -> subscription.getUserId().equals(userId))
                .sorted(Comparator.comparing(PushSubscriptionEntity::getId))
                .collect(Collectors.toList());
    }

    @Override
    public PushSubscriptionEntity saveSubscription(Long userId, String endpoint, String p256dhKey, String authKey) {
        checkWritable();
        PushSubscriptionEntity subscription = subscriptions.values().stream()
                .filter(existing -> existing.getEndpoint().equals(endpoint))
                .findFirst()
                .orElseGet(() -> PushSubscriptionEntity.builder().id(ids.incrementAndGet()).endpoint(endpoint).build());
        subscription.setUserId(userId);
        subscription.setP256dhKey(p256dhKey);
        subscription.setAuthKey(authKey);
        subscription.setCreatedAt(Instant.now());
        subscriptions.put(subscription.getId(), subscription);
        return subscription;
    }

    @Override
    public void deleteSubscription(Long subscriptionId) {
        checkWritable();
        subscriptions.remove(subscriptionId);
    }

    private void checkWritable() {
        if (failWrites) {
            throw new StorageException("Simulated storage outage");
        }
    }
}
