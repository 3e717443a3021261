package com.privatedocs.qa.config;

import com.privatedocs.qa.service.resilience.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public RetryPolicy embeddingRetryPolicy(@Value("${docqa.embeddings.retry.max-attempts:3}") int maxAttempts,
                                            @Value("${docqa.embeddings.retry.base-delay-ms:500}") long baseDelayMs,
                                            @Value("${docqa.embeddings.retry.max-delay-ms:5000}") long maxDelayMs,
                                            @Value("${docqa.embeddings.retry.jitter:0.5}") double jitter) {
        return new RetryPolicy("embeddings", maxAttempts, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs), jitter);
    }

    @Bean
    public RetryPolicy synthesisRetryPolicy(@Value("${docqa.llm.retry.max-attempts:2}") int maxAttempts,
                                            @Value("${docqa.llm.retry.base-delay-ms:1000}") long baseDelayMs,
                                            @Value("${docqa.llm.retry.max-delay-ms:8000}") long maxDelayMs,
                                            @Value("${docqa.llm.retry.jitter:0.5}") double jitter) {
        return new RetryPolicy("synthesis", maxAttempts, Duration.ofMillis(baseDelayMs), Duration.ofMillis(maxDelayMs), jitter);
    }
}
