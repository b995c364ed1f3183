package com.chattrix.websocket.repository;

import com.chattrix.websocket.domain.ConversationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for private conversations. Callers pass the pair already in (min, max) order.
 */
@Repository
public interface ConversationRepository extends JpaRepository<ConversationEntity, Long> {

    Optional<ConversationEntity> findByUser1IdAndUser2Id(Long user1Id, Long user2Id);
}
