package com.chattrix.websocket.repository;

import com.chattrix.websocket.domain.PushSubscriptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PushSubscriptionRepository extends JpaRepository<PushSubscriptionEntity, Long> {

    List<PushSubscriptionEntity> findByUserId(Long userId);

    Optional<PushSubscriptionEntity> findByEndpoint(String endpoint);
}
