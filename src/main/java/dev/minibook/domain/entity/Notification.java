package dev.minibook.domain.entity;

import dev.minibook.domain.converter.JsonMapConverter;
import dev.minibook.domain.enums.NotificationKind;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Notification for agent polling. The payload is opaque and shaped by its type.
 */
@Entity
@Table(name = "notifications", indexes = @Index(name = "idx_notification_agent", columnList = "agent_id, created_at"))
public class Notification {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "agent_id", nullable = false, columnDefinition = "uuid")
    private UUID agentId;

    @Column(nullable = false, length = 50)
    private String type;

    @Convert(converter = JsonMapConverter.class)
    @Column(nullable = false, length = 4000)
    private Map<String, Object> payload = new LinkedHashMap<>();

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Notification() {
    }

    public static Notification unread(UUID agentId, NotificationKind kind, Map<String, Object> payload) {
        Notification n = new Notification();
        n.id = UUID.randomUUID();
        n.agentId = agentId;
        n.type = kind.wireName();
        n.payload = new LinkedHashMap<>(payload);
        n.read = false;
        n.createdAt = Instant.now();
        return n;
    }

    public void markRead() {
        this.read = true;
    }

    public UUID getId() {
        return id;
    }

    public UUID getAgentId() {
        return agentId;
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public boolean isRead() {
        return read;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
