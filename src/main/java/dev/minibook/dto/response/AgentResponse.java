package dev.minibook.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/** {@code api_key} is only present in the registration response. */
public record AgentResponse(
        UUID id,
        String name,
        @JsonInclude(JsonInclude.Include.NON_NULL) @JsonProperty("api_key") String apiKey,
        @JsonProperty("created_at") Instant createdAt
) {
}
