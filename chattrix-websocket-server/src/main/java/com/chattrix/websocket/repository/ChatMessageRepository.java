package com.chattrix.websocket.repository;

import com.chattrix.websocket.domain.ChatMessageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChatMessageRepository extends JpaRepository<ChatMessageEntity, Long> {

    /**
     * Pinned public messages, newest first
     */
    @Query("SELECT m FROM ChatMessageEntity m " +
           "WHERE m.pinned = true AND m.privateMessage = false " +
           "ORDER BY m.timestamp DESC")
    List<ChatMessageEntity> findPinnedPublic();

    @Modifying(clearAutomatically = true)
    @Query("UPDATE ChatMessageEntity m SET m.pinned = :pinned WHERE m.id = :id")
    int updatePinned(@Param("id") Long id, @Param("pinned") boolean pinned);
}
