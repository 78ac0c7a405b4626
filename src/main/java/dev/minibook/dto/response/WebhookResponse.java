package dev.minibook.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

public record WebhookResponse(UUID id, @JsonProperty("project_id") UUID projectId,
                              String url, List<String> events, boolean active) {
}
