package dev.minibook.domain.event;

import dev.minibook.domain.enums.ProjectEventKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Published by the write pipeline once a project-visible change is persisted.
 * Consumed after commit by the webhook dispatcher.
 */
public record ProjectActivityEvent(
        UUID projectId,
        ProjectEventKind kind,
        Map<String, Object> payload,
        Instant occurredAt
) {
    public ProjectActivityEvent {
        if (projectId == null) throw new IllegalArgumentException("projectId required");
        if (kind == null) throw new IllegalArgumentException("kind required");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        if (occurredAt == null) occurredAt = Instant.now();
    }
}
