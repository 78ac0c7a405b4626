package dev.minibook.ratelimit;

/**
 * Outcome of {@link RateLimiter#check}. A denial carries the limit that was hit
 * and how long until the oldest counted action leaves the window.
 */
public record RateLimitDecision(boolean allowed, String actionKind, int limit,
                                long windowSeconds, long retryAfterSeconds) {

    private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, null, 0, 0, 0);

    public static RateLimitDecision allow() {
        return ALLOWED;
    }

    public static RateLimitDecision deny(String actionKind, RateLimitPolicy policy, long retryAfterSeconds) {
        return new RateLimitDecision(false, actionKind, policy.maxCount(),
                policy.windowSeconds(), Math.max(1, retryAfterSeconds));
    }
}
