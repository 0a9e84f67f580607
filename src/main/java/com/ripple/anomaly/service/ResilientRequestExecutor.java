package com.ripple.anomaly.service;

import com.ripple.anomaly.config.AnomalyDetectorConfig;
import com.ripple.anomaly.exception.AnomalyDetectorException;
import com.ripple.anomaly.exception.FailureKind;
import com.ripple.anomaly.exception.RateLimitedException;
import com.ripple.anomaly.model.AnomalyDetectorRequest;
import com.ripple.anomaly.model.ResponseOutcome;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpRequest;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Sends requests to the anomaly detector service and retries failed attempts.
 *
 * <p>Every attempt is authenticated with the configured subscription key. Outcomes:
 * <ul>
 *   <li>2xx "No Content": empty string</li>
 *   <li>2xx "Created": the {@code Location} header</li>
 *   <li>other 2xx: the response body</li>
 *   <li>429: waits {@code Retry-After} seconds, then retries</li>
 *   <li>anything else: {@link AnomalyDetectorException}, retried until the backoff sequence runs out</li>
 * </ul>
 *
 * <p>Calls block the calling thread for the round trip and for every backoff and
 * {@code Retry-After} wait. The executor holds no per-call state and may be shared between threads.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResilientRequestExecutor {

    public static final String SUBSCRIPTION_KEY_HEADER = "Ocp-Apim-Subscription-Key";

    private final RestTemplate restTemplate;
    private final AnomalyDetectorConfig anomalyDetectorConfig;
    private final ResponseClassifier responseClassifier;
    private final Retry anomalyDetectorRetry;

    /**
     * Executes the request against {@code basePath}, retrying per the configured backoff sequence.
     *
     * @param request     method, extra headers and optional body
     * @param basePath    absolute URL of the vendor endpoint
     * @param queryParams query parameters, URL-encoded and appended only when non-empty
     * @return empty string, a location URL or the response body
     * @throws AnomalyDetectorException the last attempt's failure once all retries are used
     */
    public String execute(AnomalyDetectorRequest request, String basePath, Map<String, String> queryParams) {
        URI uri = buildUri(basePath, queryParams);
        return anomalyDetectorRetry.executeSupplier(() -> executeOnce(request, uri));
    }

    static URI buildUri(String basePath, Map<String, String> queryParams) {
        if (queryParams == null || queryParams.isEmpty()) {
            return URI.create(basePath);
        }
        UriComponentsBuilder builder = UriComponentsBuilder.fromUri(URI.create(basePath));
        queryParams.forEach((name, value) -> builder.queryParam(encodeQueryParam(name), encodeQueryParam(value)));
        return builder.build(true).toUri();
    }

    /**
     * Query-param encoding that also escapes {@code '+'}, which servers otherwise read as a space
     * (timestamps such as {@code 2021-01-01T00:00:00+08:00}).
     */
    static String encodeQueryParam(String value) {
        return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8).replace("+", "%2B");
    }

    private String executeOnce(AnomalyDetectorRequest request, URI uri) {
        log.debug("Calling anomaly detector: {} {}", request.getMethod(), uri);

        ResponseOutcome outcome;
        try {
            outcome = restTemplate.execute(uri, request.getMethod(),
                httpRequest -> writeRequest(request, httpRequest),
                response -> responseClassifier.classify(uri, response));
        } catch (ResourceAccessException e) {
            log.warn("Timeout or connection error calling anomaly detector {}: {}", uri, e.getMessage());
            throw new AnomalyDetectorException(FailureKind.NETWORK,
                "Failed: connection error: " + e.getMessage() + " requestUrl: " + uri + requestBodySuffix(request),
                uri.toString(), e);
        } catch (RestClientException e) {
            log.error("Error calling anomaly detector {}: {}", uri, e.getMessage());
            throw new AnomalyDetectorException(FailureKind.MALFORMED_RESPONSE,
                "Failed: " + e.getMessage() + " requestUrl: " + uri + requestBodySuffix(request),
                uri.toString(), e);
        }

        if (outcome == null) {
            throw new AnomalyDetectorException(FailureKind.MALFORMED_RESPONSE,
                "Failed: no response requestUrl: " + uri, 0, uri.toString(), null);
        }

        switch (outcome.getType()) {
            case NO_CONTENT:
                return "";
            case CREATED:
                return outcome.getLocation();
            case SUCCESS:
                return outcome.getBody();
            case RATE_LIMITED:
                awaitRetryAfter(outcome.getRetryAfterSeconds(), uri);
                throw new RateLimitedException(uri.toString(), outcome.getRetryAfterSeconds(), outcome.getBody());
            default:
                throw failure(outcome, request);
        }
    }

    private void writeRequest(AnomalyDetectorRequest request, ClientHttpRequest httpRequest) throws IOException {
        HttpHeaders headers = httpRequest.getHeaders();
        request.getHeaders().forEach(headers::set);
        headers.set(SUBSCRIPTION_KEY_HEADER, anomalyDetectorConfig.getSubscriptionKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (request.hasBody()) {
            StreamUtils.copy(request.getBody(), StandardCharsets.UTF_8, httpRequest.getBody());
        }
    }

    private AnomalyDetectorException failure(ResponseOutcome outcome, AnomalyDetectorRequest request) {
        FailureKind kind = HttpStatus.Series.resolve(outcome.getStatusCode()) == HttpStatus.Series.SUCCESSFUL
            ? FailureKind.MALFORMED_RESPONSE
            : FailureKind.HTTP_STATUS;
        String message = String.format("Failed: response: %s %s requestUrl: %s%s",
            outcome.getStatusLine(), outcome.getBody(), outcome.getRequestUrl(), requestBodySuffix(request));
        log.warn("Anomaly detector call failed with {} for {}", outcome.getStatusLine(), outcome.getRequestUrl());
        return new AnomalyDetectorException(kind, message,
            outcome.getStatusCode(), outcome.getRequestUrl(), outcome.getBody());
    }

    private void awaitRetryAfter(long retryAfterSeconds, URI uri) {
        if (retryAfterSeconds <= 0) {
            return;
        }
        log.warn("Anomaly detector rate limited {}; waiting {}s before retrying", uri, retryAfterSeconds);
        try {
            TimeUnit.SECONDS.sleep(retryAfterSeconds);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for Retry-After on " + uri, e);
        }
    }

    private static String requestBodySuffix(AnomalyDetectorRequest request) {
        return request.hasBody() ? " requestBody: " + request.getBody() : "";
    }
}
