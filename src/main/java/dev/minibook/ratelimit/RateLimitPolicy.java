package dev.minibook.ratelimit;

import java.time.Duration;

/**
 * At most {@code maxCount} allowed actions inside any trailing {@code window}.
 */
public record RateLimitPolicy(int maxCount, Duration window) {

    public RateLimitPolicy {
        if (maxCount <= 0) throw new IllegalArgumentException("maxCount <= 0");
        if (window == null || window.isZero() || window.isNegative())
            throw new IllegalArgumentException("window <= 0");
    }

    public long windowSeconds() {
        return window.toSeconds();
    }

    @Override
    public String toString() {
        return maxCount + "/" + window.toSeconds() + "s";
    }
}
