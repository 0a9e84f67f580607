package com.ripple.anomaly.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

/**
 * Classified response of a single attempt. Which fields are populated depends on {@link #type}:
 * {@code body} for SUCCESS and FAILURE, {@code location} for CREATED,
 * {@code retryAfterSeconds} for RATE_LIMITED.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class ResponseOutcome {
    OutcomeType type;
    int statusCode;
    String reasonPhrase;
    String body;
    String location;
    long retryAfterSeconds;
    String requestUrl;

    public static ResponseOutcome success(int statusCode, String body) {
        return ResponseOutcome.builder().type(OutcomeType.SUCCESS).statusCode(statusCode).body(body).build();
    }

    public static ResponseOutcome created(String location) {
        return ResponseOutcome.builder().type(OutcomeType.CREATED).statusCode(201).location(location).build();
    }

    public static ResponseOutcome noContent() {
        return ResponseOutcome.builder().type(OutcomeType.NO_CONTENT).statusCode(204).body("").build();
    }

    public static ResponseOutcome rateLimited(long retryAfterSeconds, String requestUrl, String body) {
        return ResponseOutcome.builder()
            .type(OutcomeType.RATE_LIMITED)
            .statusCode(429)
            .retryAfterSeconds(retryAfterSeconds)
            .requestUrl(requestUrl)
            .body(body)
            .build();
    }

    public static ResponseOutcome failure(int statusCode, String reasonPhrase, String body, String requestUrl) {
        return ResponseOutcome.builder()
            .type(OutcomeType.FAILURE)
            .statusCode(statusCode)
            .reasonPhrase(reasonPhrase)
            .body(body)
            .requestUrl(requestUrl)
            .build();
    }

    /** Status line as {@code "404 Not Found"}. */
    public String getStatusLine() {
        return reasonPhrase == null || reasonPhrase.isEmpty()
            ? String.valueOf(statusCode)
            : statusCode + " " + reasonPhrase;
    }
}
