package com.chattrix.websocket.storage;

import com.chattrix.websocket.domain.ChatMessageEntity;
import com.chattrix.websocket.domain.ConversationEntity;
import com.chattrix.websocket.domain.PushSubscriptionEntity;
import com.chattrix.websocket.domain.UserAccount;
import com.chattrix.websocket.repository.ConversationRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaChatStorage.class)
class JpaChatStorageTest {

    @Autowired
    private JpaChatStorage storage;

    @Autowired
    private ConversationRepository conversationRepository;

    @Autowired
    private TestEntityManager entityManager;

    private ChatMessageEntity publicMessage(String text) {
        return storage.createMessage(ChatMessageEntity.builder().senderId(1L).text(text).build());
    }

    private ChatMessageEntity privateMessage(String text) {
        return storage.createMessage(ChatMessageEntity.builder()
                .senderId(1L).recipientId(2L).text(text).privateMessage(true).build());
    }

    @Test
    void createdMessageGetsIdAndTimestamp() {
        ChatMessageEntity saved = publicMessage("hello");

        assertNotNull(saved.getId());
        assertNotNull(saved.getTimestamp());
        assertFalse(saved.isPinned());
        assertEquals("hello", storage.getMessage(saved.getId()).orElseThrow().getText());
    }

    @Test
    void conversationIsSharedByBothDirections() {
        Long forward = storage.findOrCreateConversation(1L, 2L);
        Long backward = storage.findOrCreateConversation(2L, 1L);

        assertEquals(forward, backward);
        assertEquals(1, conversationRepository.count());
        assertEquals(1L, conversationRepository.findById(forward).orElseThrow().getUser1Id());
    }

    @Test
    void conversationTracksLastMessage() {
        Long conversationId = storage.findOrCreateConversation(2L, 1L);
        ChatMessageEntity message = privateMessage("psst");
        Instant at = Instant.parse("2024-05-01T10:15:30Z");

        storage.updateConversationLastMessage(conversationId, message.getId(), at);

        entityManager.flush();
        entityManager.clear();
        assertEquals(message.getId(), conversationRepository.findById(conversationId).orElseThrow().getLastMessageId());
        assertEquals(at, conversationRepository.findById(conversationId).orElseThrow().getUpdatedAt());
    }

    @Test
    void privateMessageIsStoredWithItsConversation() {
        ChatMessageEntity saved = storage.createPrivateMessage(ChatMessageEntity.builder()
                .senderId(2L).recipientId(1L).text("hello").privateMessage(true).build());

        entityManager.flush();
        entityManager.clear();
        assertNotNull(saved.getId());
        assertEquals(1, conversationRepository.count());
        ConversationEntity conversation = conversationRepository.findAll().get(0);
        assertEquals(1L, conversation.getUser1Id());
        assertEquals(2L, conversation.getUser2Id());
        assertEquals(saved.getId(), conversation.getLastMessageId());
    }

    @Test
    void pinningMissingMessageReportsFalse() {
        assertFalse(storage.setPinned(12345L, true));
    }

    @Test
    void pinnedListHoldsOnlyPublicMessages() {
        ChatMessageEntity kept = publicMessage("announcement");
        ChatMessageEntity other = publicMessage("chatter");
        ChatMessageEntity hidden = privateMessage("secret");
        entityManager.flush();

        assertTrue(storage.setPinned(kept.getId(), true));
        assertTrue(storage.setPinned(hidden.getId(), true));

        List<Long> pinned = storage.listPinnedMessages().stream()
                .map(ChatMessageEntity::getId)
                .collect(Collectors.toList());
        assertEquals(List.of(kept.getId()), pinned);
        assertFalse(storage.getMessage(other.getId()).orElseThrow().isPinned());
    }

    @Test
    void unpinClearsFlag() {
        ChatMessageEntity message = publicMessage("temporary");
        storage.setPinned(message.getId(), true);

        assertTrue(storage.setPinned(message.getId(), false));
        assertTrue(storage.listPinnedMessages().isEmpty());
    }

    @Test
    void subscriptionIsUpsertedByEndpoint() {
        storage.saveSubscription(1L, "https://push.example/device", "old-key", "old-auth");
        storage.saveSubscription(2L, "https://push.example/device", "new-key", "new-auth");
        storage.saveSubscription(2L, "https://push.example/laptop", "k", "a");

        assertTrue(storage.listSubscriptions(1L).isEmpty());
        List<PushSubscriptionEntity> subscriptions = storage.listSubscriptions(2L);
        assertEquals(2, subscriptions.size());
        PushSubscriptionEntity device = subscriptions.stream()
                .filter(s -> s.getEndpoint().endsWith("/device"))
                .findFirst()
                .orElseThrow();
        assertEquals("new-key", device.getP256dhKey());
    }

    @Test
    void deletedSubscriptionIsGone() {
        PushSubscriptionEntity subscription = storage.saveSubscription(1L, "https://push.example/x", "k", "a");

        storage.deleteSubscription(subscription.getId());

        assertTrue(storage.listSubscriptions(1L).isEmpty());
    }

    @Test
    void findUserReadsAccount() {
        UserAccount account = entityManager.persistFlushFind(UserAccount.builder()
                .username("alice").displayName("Alice").profilePic("default.jpg").build());

        assertEquals("Alice", storage.findUser(account.getId()).orElseThrow().getDisplayName());
        assertTrue(storage.findUser(account.getId() + 1000).isEmpty());
    }
}
