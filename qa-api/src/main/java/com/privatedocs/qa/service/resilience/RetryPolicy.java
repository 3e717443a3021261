package com.privatedocs.qa.service.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Objects;

public record RetryPolicy(String name,
                          int maxAttempts,
                          Duration baseDelay,
                          Duration maxDelay,
                          double jitter) {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        Objects.requireNonNull(name, "name");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        baseDelay = baseDelay == null || baseDelay.isNegative() ? Duration.ZERO : baseDelay;
        maxDelay = maxDelay == null || maxDelay.compareTo(baseDelay) < 0 ? baseDelay : maxDelay;
        jitter = Math.min(1.0, Math.max(0.0, jitter));
    }

    public static RetryPolicy none(String name) {
        return new RetryPolicy(name, 1, Duration.ZERO, Duration.ZERO, 0.0);
    }

    public <T> Mono<T> apply(Mono<T> source) {
        if (maxAttempts == 1) {
            return source;
        }
        long retries = maxAttempts - 1L;
        if (baseDelay.isZero()) {
            return source.retryWhen(Retry.max(retries)
                    .doBeforeRetry(signal -> logRetry(signal.totalRetries(), signal.failure()))
                    .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
        }
        return source.retryWhen(Retry.backoff(retries, baseDelay)
                .maxBackoff(maxDelay)
                .jitter(jitter)
                .doBeforeRetry(signal -> logRetry(signal.totalRetries(), signal.failure()))
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
    }

    private void logRetry(long retriesSoFar, Throwable failure) {
        log.warn("{} attempt {}/{} failed, retrying: {}", name, retriesSoFar + 1, maxAttempts, failure.getMessage());
    }
}
