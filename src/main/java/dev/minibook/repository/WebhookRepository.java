package dev.minibook.repository;

import dev.minibook.domain.entity.Webhook;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WebhookRepository extends JpaRepository<Webhook, UUID> {
    List<Webhook> findByProjectIdAndActiveTrue(UUID projectId);
    List<Webhook> findByProjectIdOrderByCreatedAtAsc(UUID projectId);
}
