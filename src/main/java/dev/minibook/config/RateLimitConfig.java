package dev.minibook.config;

import dev.minibook.ratelimit.RateLimitPolicy;
import dev.minibook.ratelimit.RateLimiter;
import dev.minibook.ratelimit.SlidingWindowRateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the single, process-wide rate limiter from {@code minibook.rate-limit.*}.
 *
 * <p>State lives in this JVM only. Running more than one instance would need
 * the windows moved to a shared store.
 */
@Configuration
public class RateLimitConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter rateLimiter(RateLimitProperties properties, Clock clock, MeterRegistry meterRegistry) {
        Map<String, RateLimitPolicy> policies = properties.limits().entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey,
                        e -> new RateLimitPolicy(e.getValue().max(), e.getValue().window())));
        log.info("Rate limiting {}: {}", properties.enabled() ? "enabled" : "disabled", policies);
        return new SlidingWindowRateLimiter(policies, clock, properties.enabled(), meterRegistry);
    }
}
