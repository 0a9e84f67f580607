package com.ripple.anomaly.exception;

import lombok.Getter;

/**
 * HTTP 429 from the anomaly detector service. Thrown after the caller has already waited
 * the advertised {@code Retry-After}, so that the retry loop issues the next attempt.
 */
@Getter
public class RateLimitedException extends AnomalyDetectorException {

    private final long retryAfterSeconds;

    public RateLimitedException(String requestUrl, long retryAfterSeconds, String responseBody) {
        super(FailureKind.RATE_LIMITED,
            String.format("Rate limited: response: 429 Too Many Requests (Retry-After: %ds) requestUrl: %s",
                retryAfterSeconds, requestUrl),
            429, requestUrl, responseBody);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
