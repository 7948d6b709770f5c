package com.fintech.donations.config;

import com.fintech.donations.exception.DonationNotYetRecordedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;

/**
 * Resilience settings for calls that leave the process or wait on other deliveries.
 * <p>
 * The circuit breaker protects webhook handling against a slow or failing
 * Stripe API. States:
 * - CLOSED: Normal operation, lookups pass through
 * - OPEN: Stripe is failing, lookups fail fast
 * - HALF_OPEN: Testing if Stripe has recovered
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Bounded retry for finding the donation a dispute refers to. The dispute event can
     * arrive before the event that creates the donation has been processed.
     * Defaults: 3 attempts, waiting 1s then 2s.
     */
    @Bean
    public RetryTemplate disputeLookupRetryTemplate(
            @Value("${donations.dispute-lookup.max-attempts:3}") int maxAttempts,
            @Value("${donations.dispute-lookup.initial-backoff-ms:1000}") long initialBackoffMs,
            @Value("${donations.dispute-lookup.max-backoff-ms:2000}") long maxBackoffMs) {
        return RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .exponentialBackoff(initialBackoffMs, 2.0, maxBackoffMs)
                .retryOn(DonationNotYetRecordedException.class)
                .build();
    }
}
