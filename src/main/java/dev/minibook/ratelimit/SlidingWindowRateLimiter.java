package dev.minibook.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Exact sliding window (log) per (actor, action kind).
 *
 * <p>Each key owns a deque of the timestamps of its allowed actions. A check
 * at {@code now} counts the entries newer than {@code now - window}; it is
 * allowed iff that count is below the limit, and then {@code now} is appended.
 *
 * <p>Thread-safety: the count and the append run inside
 * {@code asMap().compute(key, ...)}, which is atomic per key, so two checks for
 * the same key can never both take the last slot. Different keys do not
 * contend. Stats only read, under the window's monitor.
 *
 * <p>Memory: a window expires once it has not been written for one full
 * window length. At that point every timestamp in it is outside the window,
 * so dropping it cannot free a slot early. {@link #compact()} additionally
 * prunes stale timestamps and removes windows left empty.
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final Map<String, RateLimitPolicy> policies;
    private final Clock clock;
    private final boolean enabled;
    private final MeterRegistry meterRegistry;
    private final Cache<ActionKey, ActionWindow> windows;

    public SlidingWindowRateLimiter(Map<String, RateLimitPolicy> policies, Clock clock,
                                    boolean enabled, MeterRegistry meterRegistry) {
        this.policies = Map.copyOf(policies);
        this.clock = clock;
        this.enabled = enabled;
        this.meterRegistry = meterRegistry;
        this.windows = Caffeine.newBuilder()
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .expireAfter(new WindowExpiry())
                .build();
    }

    @Override
    public RateLimitDecision check(String actorId, String actionKind) {
        RateLimitPolicy policy = policies.get(actionKind);
        if (!enabled || policy == null) {
            return RateLimitDecision.allow();
        }

        ActionKey key = new ActionKey(actorId, actionKind);
        RateLimitDecision[] decision = new RateLimitDecision[1];
        windows.asMap().compute(key, (k, existing) -> {
            ActionWindow window = existing != null ? existing : new ActionWindow(policy);
            decision[0] = window.tryRecord(clock.millis(), actionKind);
            return window;
        });

        if (!decision[0].allowed()) {
            meterRegistry.counter("minibook.ratelimit.denied", "action", actionKind).increment();
            log.debug("Rate limit hit: actor={}, action={}, limit={}", actorId, actionKind, policy);
        }
        return decision[0];
    }

    @Override
    public Map<String, RateLimitUsage> stats(String actorId) {
        long now = clock.millis();
        Map<String, RateLimitUsage> stats = new TreeMap<>();
        policies.forEach((actionKind, policy) -> {
            ActionWindow window = windows.getIfPresent(new ActionKey(actorId, actionKind));
            int used = window != null ? window.countInWindow(now) : 0;
            stats.put(actionKind, RateLimitUsage.of(used, policy));
        });
        return stats;
    }

    @Override
    public void compact() {
        long now = clock.millis();
        long before = windows.estimatedSize();
        windows.asMap().keySet().forEach(key ->
                windows.asMap().computeIfPresent(key, (k, window) -> window.pruneIsEmpty(now) ? null : window));
        windows.cleanUp();
        log.debug("Rate limiter compaction: {} -> {} windows", before, windows.estimatedSize());
    }

    long trackedWindows() {
        windows.cleanUp();
        return windows.estimatedSize();
    }

    private record ActionKey(String actorId, String actionKind) {
    }

    private static final class ActionWindow {
        private final RateLimitPolicy policy;
        private final long windowMillis;
        private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

        ActionWindow(RateLimitPolicy policy) {
            this.policy = policy;
            this.windowMillis = policy.window().toMillis();
        }

        synchronized RateLimitDecision tryRecord(long now, String actionKind) {
            prune(now);
            if (timestamps.size() < policy.maxCount()) {
                timestamps.addLast(now);
                return RateLimitDecision.allow();
            }
            long retryAfterMillis = timestamps.peekFirst() + windowMillis - now;
            return RateLimitDecision.deny(actionKind, policy, (retryAfterMillis + 999) / 1000);
        }

        synchronized int countInWindow(long now) {
            long cutoff = now - windowMillis;
            int count = 0;
            for (long ts : timestamps) {
                if (ts > cutoff) count++;
            }
            return count;
        }

        synchronized boolean pruneIsEmpty(long now) {
            prune(now);
            return timestamps.isEmpty();
        }

        private void prune(long now) {
            long cutoff = now - windowMillis;
            while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
                timestamps.removeFirst();
            }
        }
    }

    // Reads do not extend a window's life; only checks (writes) do.
    private static final class WindowExpiry implements Expiry<ActionKey, ActionWindow> {
        @Override
        public long expireAfterCreate(ActionKey key, ActionWindow window, long currentTime) {
            return TimeUnit.MILLISECONDS.toNanos(window.windowMillis);
        }

        @Override
        public long expireAfterUpdate(ActionKey key, ActionWindow window, long currentTime, long currentDuration) {
            return TimeUnit.MILLISECONDS.toNanos(window.windowMillis);
        }

        @Override
        public long expireAfterRead(ActionKey key, ActionWindow window, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
