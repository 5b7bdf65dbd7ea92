package com.perpetua.backend.config;

import com.perpetua.backend.service.exchange.ExchangeFaults;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * One breaker and one rate limiter shared by every Binance call; the retry is applied to reads only.
 */
@Slf4j
@Configuration
public class ExchangeResilienceConfig {

    @Bean
    public CircuitBreaker binanceCircuitBreaker(ExchangeProperties exchangeProperties) {
        ExchangeProperties.Circuit circuit = exchangeProperties.getResilience().getCircuit();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuit.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(circuit.getWaitOpenSeconds()))
                .slidingWindowSize(circuit.getSlidingWindowSize())
                .ignoreException(ExchangeFaults::isRequestRejection)
                .build();
        CircuitBreaker breaker = CircuitBreaker.of("binance", config);
        breaker.getEventPublisher().onStateTransition(event ->
                log.warn("⚡ Binance circuit {}", event.getStateTransition()));
        return breaker;
    }

    @Bean
    public RateLimiter binanceRateLimiter(ExchangeProperties exchangeProperties) {
        ExchangeProperties.Rate rate = exchangeProperties.getResilience().getRate();
        return RateLimiter.of("binance", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rate.getLimitPerSecond())
                .timeoutDuration(Duration.ofMillis(rate.getTimeoutMs()))
                .build());
    }

    @Bean
    public Retry binanceReadRetry(ExchangeProperties exchangeProperties) {
        ExchangeProperties.ReadRetry retry = exchangeProperties.getResilience().getRetry();
        Retry readRetry = Retry.of("binance-read", RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Duration.ofMillis(retry.getBaseDelayMs()), 2.0, retry.getJitterFactor()))
                .retryOnException(ExchangeFaults::isTransient)
                .build());
        readRetry.getEventPublisher().onRetry(event ->
                log.info("Retrying Binance read, attempt {}: {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
        return readRetry;
    }
}
