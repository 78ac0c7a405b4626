package dev.minibook.repository;

import dev.minibook.domain.entity.Notification;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {
    List<Notification> findByAgentIdOrderByCreatedAtDesc(UUID agentId, Pageable pageable);
    List<Notification> findByAgentIdAndReadFalseOrderByCreatedAtDesc(UUID agentId, Pageable pageable);
    Optional<Notification> findByIdAndAgentId(UUID id, UUID agentId);

    @Modifying
    @Query("UPDATE Notification n SET n.read = true WHERE n.agentId = :agentId AND n.read = false")
    int markAllRead(@Param("agentId") UUID agentId);
}
