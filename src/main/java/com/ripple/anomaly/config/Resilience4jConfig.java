package com.ripple.anomaly.config;

import com.ripple.anomaly.exception.AnomalyDetectorException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;

/**
 * Configuration for the Resilience4j retry wrapped around anomaly detector calls.
 *
 * <p>The retry walks a fixed backoff sequence ({@code anomaly-detector.retry.backoff-ms}):
 * the n-th failed attempt waits the n-th delay, so a sequence of three delays allows
 * four attempts in total. Once the sequence is used up the last exception is rethrown
 * unchanged.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    public static final String ANOMALY_DETECTOR = "anomalyDetector";

    @Bean
    public Retry anomalyDetectorRetry(RetryRegistry retryRegistry, AnomalyDetectorConfig config) {
        Retry retry = retryRegistry.retry(ANOMALY_DETECTOR, backoffSequence(config.getRetryBackoffMs()));
        retry.getEventPublisher().onRetry(event ->
            log.warn("Retrying anomaly detector call (attempt {}) after {} ms: {}",
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }

    /**
     * Builds a retry config that consumes the given delays one per failed attempt.
     *
     * @param delaysMs backoff delays in milliseconds, in the order they are consumed
     * @return config allowing {@code delaysMs.length + 1} attempts
     */
    public static RetryConfig backoffSequence(long[] delaysMs) {
        long[] delays = delaysMs == null ? new long[0] : Arrays.copyOf(delaysMs, delaysMs.length);
        for (long delay : delays) {
            if (delay < 0) {
                throw new IllegalArgumentException("Backoff delays must not be negative: " + Arrays.toString(delays));
            }
        }
        IntervalFunction interval = attempt -> delays[Math.min(attempt, delays.length) - 1];
        return RetryConfig.custom()
            .maxAttempts(delays.length + 1)
            .intervalFunction(interval)
            .retryExceptions(AnomalyDetectorException.class)
            .build();
    }
}
