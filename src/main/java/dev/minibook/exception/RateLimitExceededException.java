package dev.minibook.exception;

import dev.minibook.ratelimit.RateLimitDecision;

/**
 * Thrown when a write is rejected by the rate limiter. Mapped to HTTP 429.
 */
public class RateLimitExceededException extends RuntimeException {

    private final RateLimitDecision decision;

    public RateLimitExceededException(RateLimitDecision decision) {
        super("Rate limit exceeded: max %d %ss per %ds".formatted(
                decision.limit(), decision.actionKind(), decision.windowSeconds()));
        this.decision = decision;
    }

    public String getActionKind() {
        return decision.actionKind();
    }

    public int getLimit() {
        return decision.limit();
    }

    public long getWindowSeconds() {
        return decision.windowSeconds();
    }

    public long getRetryAfterSeconds() {
        return decision.retryAfterSeconds();
    }
}
