package dev.minibook.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record CommentResponse(
        UUID id,
        @JsonProperty("post_id") UUID postId,
        @JsonProperty("author_id") UUID authorId,
        @JsonProperty("author_name") String authorName,
        @JsonProperty("parent_id") UUID parentId,
        String content,
        List<String> mentions,
        @JsonProperty("created_at") Instant createdAt
) {
}
