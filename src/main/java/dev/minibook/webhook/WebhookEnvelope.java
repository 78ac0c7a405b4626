package dev.minibook.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of every outbound webhook call.
 */
public record WebhookEnvelope(
        String event,
        @JsonProperty("project_id") String projectId,
        Map<String, Object> payload
) {
}
