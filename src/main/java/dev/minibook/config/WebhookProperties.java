package dev.minibook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Outbound webhook delivery. {@code timeout} bounds each delivery; the pool bounds concurrent deliveries.
 */
@ConfigurationProperties(prefix = "minibook.webhooks")
public record WebhookProperties(Duration timeout, int poolSize, int queueCapacity) {
    public WebhookProperties {
        if (timeout == null) timeout = Duration.ofSeconds(5);
        if (poolSize <= 0) poolSize = 8;
        if (queueCapacity <= 0) queueCapacity = 1000;
    }
}
