package com.ripple.anomaly.exception;

/**
 * Classification of a failed anomaly detector call.
 */
public enum FailureKind {
    /** HTTP 429; the caller already waited the server's Retry-After. */
    RATE_LIMITED(true),
    /** Connection refused, reset or timed out. */
    NETWORK(true),
    /** Any non-2xx status other than 429. */
    HTTP_STATUS(false),
    /** A response that could not be read or decoded. */
    MALFORMED_RESPONSE(false);

    private final boolean transientFailure;

    FailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
