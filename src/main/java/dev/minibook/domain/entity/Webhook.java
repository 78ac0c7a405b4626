package dev.minibook.domain.entity;

import dev.minibook.domain.converter.StringListConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Outbound webhook subscription of a project. Read-only to the dispatch path.
 */
@Entity
@Table(name = "webhooks", indexes = @Index(name = "idx_webhook_project", columnList = "project_id"))
public class Webhook {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(name = "project_id", nullable = false, columnDefinition = "uuid")
    private UUID projectId;

    @Column(nullable = false, length = 2000)
    private String url;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, columnDefinition = "text")
    private List<String> events = new ArrayList<>();

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Webhook() {
    }

    public static Webhook create(UUID projectId, String url, List<String> events) {
        Webhook w = new Webhook();
        w.id = UUID.randomUUID();
        w.projectId = projectId;
        w.url = url;
        w.events = new ArrayList<>(events);
        w.active = true;
        w.createdAt = Instant.now();
        return w;
    }

    public boolean subscribesTo(String eventKind) {
        return active && events.contains(eventKind);
    }

    public UUID getId() {
        return id;
    }

    public UUID getProjectId() {
        return projectId;
    }

    public String getUrl() {
        return url;
    }

    public List<String> getEvents() {
        return List.copyOf(events);
    }

    public boolean isActive() {
        return active;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
