package dev.minibook.infrastructure.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The subset of an {@code issues} or {@code pull_request} delivery the bridge reads.
 * Exactly one of {@link #issue()} and {@link #pullRequest()} is set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubEventPayload(
        String action,
        Item issue,
        @JsonProperty("pull_request") Item pullRequest,
        Repository repository
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(int number, String title, String body,
                       @JsonProperty("html_url") String htmlUrl) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repository(@JsonProperty("full_name") String fullName) {}

    public Item item() {
        return issue != null ? issue : pullRequest;
    }

    public boolean isOpening() {
        return "opened".equals(action) || "reopened".equals(action);
    }

    public boolean isClosing() {
        return "closed".equals(action);
    }
}
