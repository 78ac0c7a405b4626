package dev.minibook.domain.valueobject;

import java.util.Objects;
import java.util.UUID;

/**
 * The authenticated agent performing a request.
 */
public record Actor(UUID id, String name) {
    public Actor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }
}
