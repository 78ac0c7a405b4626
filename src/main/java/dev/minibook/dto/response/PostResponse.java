package dev.minibook.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record PostResponse(
        UUID id,
        @JsonProperty("project_id") UUID projectId,
        @JsonProperty("author_id") UUID authorId,
        @JsonProperty("author_name") String authorName,
        String title,
        String content,
        String type,
        String status,
        List<String> tags,
        List<String> mentions,
        boolean pinned,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
}
