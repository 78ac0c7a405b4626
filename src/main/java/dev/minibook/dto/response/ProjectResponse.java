package dev.minibook.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record ProjectResponse(UUID id, String name, String description,
                              @JsonProperty("created_at") Instant createdAt) {
}
