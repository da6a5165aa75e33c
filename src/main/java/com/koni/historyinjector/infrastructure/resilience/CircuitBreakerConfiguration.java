package com.koni.historyinjector.infrastructure.resilience;

import com.koni.historyinjector.domain.exception.EntityCreationFailedException;
import com.koni.historyinjector.infrastructure.api.EntityApiUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for Circuit Breaker and Retry pattern implementation.
 * Provides resilience against downstream service failures (Kafka, Home Assistant REST API).
 *
 * Circuit Breaker States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Failure threshold exceeded, requests fail fast
 * - HALF_OPEN: Testing if service recovered, limited requests allowed
 */
@Slf4j
@Configuration
public class CircuitBreakerConfiguration {

    public static final String KAFKA = "kafka";
    public static final String ENTITY_API = "entity-api";

    @Value("${injector.api.retry.max-attempts:3}")
    private int maxAttempts;

    @Value("${injector.api.retry.initial-backoff:500ms}")
    private Duration initialBackoff;

    @Value("${injector.api.retry.multiplier:2.0}")
    private double multiplier;

    /**
     * Default settings shared by all breakers:
     * - Sliding window: 10 requests (COUNT_BASED)
     * - Failure threshold: 50%
     * - Wait duration in OPEN state: 10 seconds
     * - Permitted calls in HALF_OPEN: 3
     */
    @Bean
    public CircuitBreakerConfig defaultCircuitBreakerConfig() {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50.0f)
                .waitDurationInOpenState(Duration.ofSeconds(10))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Protects publishing of rejection events.
     */
    @Bean
    public CircuitBreaker kafkaCircuitBreaker(CircuitBreakerRegistry registry) {
        return logTransitions(registry.circuitBreaker(KAFKA));
    }

    /**
     * Protects the entity management API. A refused creation (4xx) proves the API is reachable,
     * so it does not count as a failure.
     */
    @Bean
    public CircuitBreaker entityApiCircuitBreaker(CircuitBreakerRegistry registry, CircuitBreakerConfig config) {
        CircuitBreakerConfig entityApiConfig = CircuitBreakerConfig.from(config)
                .ignoreExceptions(EntityCreationFailedException.class)
                .build();
        return logTransitions(registry.circuitBreaker(ENTITY_API, entityApiConfig));
    }

    /**
     * Retries only transient entity API failures: 3 attempts, backoff 500ms then 1s by default.
     */
    @Bean
    public Retry entityApiRetry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryExceptions(EntityApiUnavailableException.class)
                .build();
        return RetryRegistry.of(config).retry(ENTITY_API);
    }

    private static CircuitBreaker logTransitions(CircuitBreaker circuitBreaker) {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("Circuit breaker {} state transition: {} -> {} (failure rate: {}%)",
                        circuitBreaker.getName(),
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState(),
                        circuitBreaker.getMetrics().getFailureRate()))
                .onCallNotPermitted(event -> log.warn("Circuit breaker {} call not permitted (circuit is OPEN)",
                        circuitBreaker.getName()));
        return circuitBreaker;
    }
}
