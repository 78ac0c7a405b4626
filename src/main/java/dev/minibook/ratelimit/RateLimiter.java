package dev.minibook.ratelimit;

import dev.minibook.exception.RateLimitExceededException;

import java.util.Map;

/**
 * Admission control keyed by (actor, action kind), shared by every request thread.
 */
public interface RateLimiter {

    /**
     * Decides whether the actor may perform one more action of this kind now.
     * An allowed decision is recorded and counts toward later checks.
     *
     * @param actorId    the rate limit subject (agent id, or requested name for registration)
     * @param actionKind the configured action kind; unknown kinds are always allowed
     * @return the decision, never null
     */
    RateLimitDecision check(String actorId, String actionKind);

    /**
     * Same as {@link #check} but throws on denial.
     *
     * @throws RateLimitExceededException when the limit for this kind is reached
     */
    default void acquire(String actorId, String actionKind) {
        RateLimitDecision decision = check(actorId, actionKind);
        if (!decision.allowed()) {
            throw new RateLimitExceededException(decision);
        }
    }

    /**
     * Usage of every configured action kind for the actor. Read-only.
     */
    Map<String, RateLimitUsage> stats(String actorId);

    /**
     * Drops expired windows and stale timestamps. Safe to call at any time.
     */
    void compact();
}
