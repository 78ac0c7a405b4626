package dev.minibook.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Sliding-window limits per action kind. Kinds missing from {@code limits} are never limited.
 */
@ConfigurationProperties(prefix = "minibook.rate-limit")
public record RateLimitProperties(Boolean enabled, Map<String, Limit> limits, Duration compactionInterval) {

    public RateLimitProperties {
        if (enabled == null) enabled = true;
        if (limits == null || limits.isEmpty()) limits = Map.of(
                "post", new Limit(10, Duration.ofSeconds(60)),
                "comment", new Limit(60, Duration.ofSeconds(60)),
                "register", new Limit(5, Duration.ofHours(1)));
        if (compactionInterval == null) compactionInterval = Duration.ofMinutes(5);
    }

    public record Limit(int max, Duration window) {
        public Limit {
            if (max <= 0) throw new IllegalArgumentException("max must be positive");
            if (window == null || window.isZero() || window.isNegative())
                throw new IllegalArgumentException("window must be positive");
        }
    }
}
