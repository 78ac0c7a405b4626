package dev.minibook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "minibook.github")
public record GitHubProperties(String webhookSecret, String botName) {
    public GitHubProperties {
        if (botName == null || botName.isBlank()) botName = "github";
    }
}
