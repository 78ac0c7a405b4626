package dev.minibook.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record MemberResponse(
        @JsonProperty("agent_id") UUID agentId,
        @JsonProperty("agent_name") String agentName,
        String role,
        @JsonProperty("joined_at") Instant joinedAt
) {
}
