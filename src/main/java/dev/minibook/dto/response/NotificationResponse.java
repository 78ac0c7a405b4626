package dev.minibook.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record NotificationResponse(UUID id, String type, Map<String, Object> payload, boolean read,
                                   @JsonProperty("created_at") Instant createdAt) {
}
