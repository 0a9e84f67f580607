package com.ripple.anomaly.exception;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;

import java.io.IOException;
import java.util.Optional;

/**
 * Raised when a call to the anomaly detector service fails.
 *
 * <p>The message always carries the request URL and, when a response was received, its status
 * line and body. Callers that need to tell vendor errors apart (for example {@code ModelNotExist}
 * or {@code InvalidTimestampFormat}) can match on the message or use {@link #getErrorCode()}.
 */
@Getter
public class AnomalyDetectorException extends RuntimeException {

    private static final ObjectMapper ERROR_READER = new ObjectMapper();

    private final FailureKind kind;
    /** HTTP status of the failed response, or 0 when no response was received. */
    private final int statusCode;
    private final String requestUrl;
    private final String responseBody;

    public AnomalyDetectorException(FailureKind kind, String message, int statusCode,
                                    String requestUrl, String responseBody) {
        super(message);
        this.kind = kind;
        this.statusCode = statusCode;
        this.requestUrl = requestUrl;
        this.responseBody = responseBody;
    }

    public AnomalyDetectorException(FailureKind kind, String message, String requestUrl, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = 0;
        this.requestUrl = requestUrl;
        this.responseBody = null;
    }

    /**
     * Vendor error code from a JSON error body shaped as {@code {"code": ...}} or
     * {@code {"error": {"code": ...}}}. Not every failure carries one.
     */
    public Optional<String> getErrorCode() {
        if (responseBody == null || responseBody.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode root = ERROR_READER.readTree(responseBody);
            JsonNode code = root.path("code");
            if (code.isMissingNode() || code.isNull()) {
                code = root.path("error").path("code");
            }
            return code.isTextual() ? Optional.of(code.asText()) : Optional.empty();
        } catch (IOException e) {
            // plain-text or HTML error page
            return Optional.empty();
        }
    }

    public boolean isTransient() {
        return kind.isTransient();
    }
}
