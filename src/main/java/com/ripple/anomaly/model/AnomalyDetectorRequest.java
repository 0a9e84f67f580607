package com.ripple.anomaly.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * Outbound request to the anomaly detector service. The target URI is supplied separately to
 * {@code ResilientRequestExecutor#execute}, which also attaches authentication and content-type
 * headers on every attempt.
 */
@Value
@Builder
public class AnomalyDetectorRequest {
    HttpMethod method;
    @Singular
    Map<String, String> headers;
    /** JSON body, or {@code null} for requests without one. */
    String body;

    public static AnomalyDetectorRequest get() {
        return AnomalyDetectorRequest.builder().method(HttpMethod.GET).build();
    }

    public static AnomalyDetectorRequest delete() {
        return AnomalyDetectorRequest.builder().method(HttpMethod.DELETE).build();
    }

    public static AnomalyDetectorRequest post(String body) {
        return AnomalyDetectorRequest.builder().method(HttpMethod.POST).body(body).build();
    }

    public boolean hasBody() {
        return body != null;
    }
}
