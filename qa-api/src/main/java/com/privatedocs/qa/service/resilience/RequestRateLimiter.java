package com.privatedocs.qa.service.resilience;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.privatedocs.qa.service.DocQaException;
import com.privatedocs.qa.service.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Token bucket per caller. Buckets refill continuously and are evicted after a period of inactivity.
 */
@Component
public class RequestRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RequestRateLimiter.class);

    private final Clock clock;
    private final int capacity;
    private final double refillPerMilli;
    private final Cache<String, TokenBucket> buckets;
    private final Counter rejections;

    public RequestRateLimiter(Clock clock,
                              MeterRegistry meterRegistry,
                              @Value("${docqa.rate-limit.capacity:60}") int capacity,
                              @Value("${docqa.rate-limit.refill-per-minute:60}") int refillPerMinute,
                              @Value("${docqa.rate-limit.idle-expiry-minutes:10}") long idleExpiryMinutes) {
        if (capacity < 1) {
            throw new IllegalArgumentException("docqa.rate-limit.capacity must be positive");
        }
        this.clock = clock;
        this.capacity = capacity;
        this.refillPerMilli = Math.max(0, refillPerMinute) / 60_000.0;
        this.buckets = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMinutes(Math.max(1, idleExpiryMinutes)))
                .build();
        this.rejections = meterRegistry.counter("docqa.ratelimit.rejections");
    }

    public void acquire(String callerId) {
        String key = callerId == null || callerId.isBlank() ? "anonymous" : callerId;
        TokenBucket bucket = buckets.get(key, ignored -> new TokenBucket(capacity, clock.millis()));
        if (!bucket.tryConsume(clock.millis())) {
            rejections.increment();
            log.warn("Rate limit exceeded for caller {}", key);
            throw new DocQaException(ErrorKind.RATE_LIMITED, "Too many requests, please retry later");
        }
    }

    private final class TokenBucket {

        private double tokens;
        private long lastRefillMillis;

        private TokenBucket(int initialTokens, long nowMillis) {
            this.tokens = initialTokens;
            this.lastRefillMillis = nowMillis;
        }

        private synchronized boolean tryConsume(long nowMillis) {
            long elapsed = Math.max(0, nowMillis - lastRefillMillis);
            if (elapsed > 0) {
                tokens = Math.min(capacity, tokens + elapsed * refillPerMilli);
                lastRefillMillis = nowMillis;
            }
            if (tokens < 1.0) {
                return false;
            }
            tokens -= 1.0;
            return true;
        }
    }
}
