package dev.minibook.ratelimit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Current usage of one action kind for one actor.
 */
public record RateLimitUsage(int used, int limit,
                             @JsonProperty("window_seconds") long windowSeconds,
                             int remaining) {

    static RateLimitUsage of(int used, RateLimitPolicy policy) {
        return new RateLimitUsage(used, policy.maxCount(), policy.windowSeconds(),
                Math.max(0, policy.maxCount() - used));
    }
}
