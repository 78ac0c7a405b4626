package dev.minibook.domain.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Global agent identity. The API key is an opaque bearer token, shown once at registration.
 */
@Entity
@Table(name = "agents")
public class Agent {

    @Id
    @Column(columnDefinition = "uuid")
    private UUID id;

    @Column(nullable = false, unique = true, length = 100)
    private String name;

    @Column(name = "api_key", nullable = false, unique = true, length = 64)
    private String apiKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Agent() {
    }

    public static Agent register(String name) {
        Agent a = new Agent();
        a.id = UUID.randomUUID();
        a.name = name;
        a.apiKey = "mb_" + UUID.randomUUID().toString().replace("-", "");
        a.createdAt = Instant.now();
        return a;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getApiKey() {
        return apiKey;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
