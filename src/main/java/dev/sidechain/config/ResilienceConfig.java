package dev.sidechain.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Timeouts, retry and circuit-breaker settings shared by the repositories and
 * the external feed/search clients.
 *
 * <pre>
 * return feedStore.addActivity(userId, activity)
 *         .timeout(resilience.getExternalTimeout())
 *         .transformDeferred(CircuitBreakerOperator.of(breaker));
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration redisTimeout;
    private final Duration externalTimeout;
    private final int databaseRetryMaxAttempts;
    private final Duration databaseRetryMinBackoff;
    private final Duration databaseRetryMaxBackoff;
    private final CircuitBreakerConfig circuitBreakerConfig;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.database.retry-max-attempts:3}") int databaseRetryMaxAttempts,
            @Value("${resilience.database.retry-min-backoff-ms:100}") int databaseRetryMinBackoffMs,
            @Value("${resilience.database.retry-max-backoff-ms:1000}") int databaseRetryMaxBackoffMs,
            @Value("${resilience.redis.timeout-seconds:2}") int redisTimeoutSeconds,
            @Value("${resilience.external.timeout-seconds:10}") int externalTimeoutSeconds,
            @Value("${resilience.circuit-breaker.failure-rate:50}") float failureRate,
            @Value("${resilience.circuit-breaker.open-seconds:30}") int openSeconds
    ) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.redisTimeout = Duration.ofSeconds(redisTimeoutSeconds);
        this.externalTimeout = Duration.ofSeconds(externalTimeoutSeconds);
        this.databaseRetryMaxAttempts = databaseRetryMaxAttempts;
        this.databaseRetryMinBackoff = Duration.ofMillis(databaseRetryMinBackoffMs);
        this.databaseRetryMaxBackoff = Duration.ofMillis(databaseRetryMaxBackoffMs);
        this.circuitBreakerConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRate)
                .waitDurationInOpenState(Duration.ofSeconds(openSeconds))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .build();
        log.info("Resilience configuration initialized (external timeout={}s, breaker failureRate={}%, open={}s)",
                externalTimeoutSeconds, failureRate, openSeconds);
    }

    public CircuitBreaker circuitBreaker(String name) {
        return CircuitBreaker.of(name, circuitBreakerConfig);
    }

    /**
     * Exponential backoff with jitter for transient database failures.
     */
    public Retry databaseRetry() {
        return Retry.backoff(databaseRetryMaxAttempts, databaseRetryMinBackoff)
                .maxBackoff(databaseRetryMaxBackoff)
                .jitter(0.5)
                .filter(this::isRetryableException)
                .doBeforeRetry(signal -> log.warn("Retrying database operation, attempt {}/{}: {}",
                        signal.totalRetries() + 1, databaseRetryMaxAttempts, signal.failure().getMessage()));
    }

    boolean isRetryableException(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null) return false;

        String lowerMessage = message.toLowerCase();
        return lowerMessage.contains("connection")
                || lowerMessage.contains("timeout")
                || lowerMessage.contains("temporarily unavailable")
                || lowerMessage.contains("too many connections")
                || lowerMessage.contains("deadlock");
    }
}
