package dev.minibook.ratelimit;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically bounds the limiter's memory for actors that stopped acting.
 */
@Component
public class RateLimitCompactionTask {

    private final RateLimiter rateLimiter;

    public RateLimitCompactionTask(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Scheduled(fixedDelayString = "${minibook.rate-limit.compaction-interval:PT5M}",
            initialDelayString = "${minibook.rate-limit.compaction-interval:PT5M}")
    public void compact() {
        rateLimiter.compact();
    }
}
