package com.chattrix.websocket.storage;

import com.chattrix.websocket.domain.ChatMessageEntity;
import com.chattrix.websocket.domain.PushSubscriptionEntity;
import com.chattrix.websocket.domain.UserAccount;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence collaborator used by the routing core.
 *
 * Every method may block and may throw
 * {@link com.chattrix.websocket.exception.StorageException}; callers run it off
 * the socket thread and treat the failure as terminal for the current event.
 */
public interface ChatStorage {

    /**
     * Persists a new message and returns it with id and timestamp assigned.
     */
    ChatMessageEntity createMessage(ChatMessageEntity message);

    /**
     * Persists a private message and points the pair's conversation at it,
     * creating the conversation on first use. Either all of it is stored or none of it.
     */
    ChatMessageEntity createPrivateMessage(ChatMessageEntity message);

    Optional<ChatMessageEntity> getMessage(Long messageId);

    /**
     * @return false when no message with that id exists
     */
    boolean setPinned(Long messageId, boolean pinned);

    List<ChatMessageEntity> listPinnedMessages();

    /**
     * Looks up the conversation for the unordered pair, creating it on first use.
     */
    Long findOrCreateConversation(Long userA, Long userB);

    void updateConversationLastMessage(Long conversationId, Long messageId, Instant timestamp);

    Optional<UserAccount> findUser(Long userId);

    List<PushSubscriptionEntity> listSubscriptions(Long userId);

    /**
     * Stores a subscription, replacing any previous one for the same endpoint.
     */
    PushSubscriptionEntity saveSubscription(Long userId, String endpoint, String p256dhKey, String authKey);

    void deleteSubscription(Long subscriptionId);
}
