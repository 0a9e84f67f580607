package com.ripple.anomaly.service;

import com.ripple.anomaly.model.ResponseOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Maps a raw HTTP response from the anomaly detector service to a {@link ResponseOutcome}.
 *
 * <p>2xx responses are told apart by reason phrase ("No Content", "Created"); when the status
 * line carries no reason phrase the status codes 204 and 201 are used instead.
 */
@Slf4j
@Component
public class ResponseClassifier {

    static final String NO_CONTENT = "No Content";
    static final String CREATED = "Created";
    static final String UNREADABLE_BODY = "Response body could not be read";

    public ResponseOutcome classify(URI requestUri, ClientHttpResponse response) throws IOException {
        int statusCode = response.getRawStatusCode();
        String reasonPhrase = response.getStatusText();
        HttpHeaders headers = response.getHeaders();
        String requestUrl = requestUri.toString();

        if (HttpStatus.Series.resolve(statusCode) == HttpStatus.Series.SUCCESSFUL) {
            if (isReason(reasonPhrase, NO_CONTENT, statusCode, HttpStatus.NO_CONTENT)) {
                return ResponseOutcome.noContent();
            }
            if (isReason(reasonPhrase, CREATED, statusCode, HttpStatus.CREATED)) {
                String location = headers.getFirst(HttpHeaders.LOCATION);
                if (!StringUtils.hasText(location)) {
                    return ResponseOutcome.failure(statusCode, reasonPhrase,
                        "Created response is missing the Location header", requestUrl);
                }
                return ResponseOutcome.created(location);
            }
            String body = readBody(response, requestUrl);
            return body == null
                ? ResponseOutcome.failure(statusCode, reasonPhrase, UNREADABLE_BODY, requestUrl)
                : ResponseOutcome.success(statusCode, body);
        }

        String body = readBody(response, requestUrl);
        if (statusCode == HttpStatus.TOO_MANY_REQUESTS.value()) {
            return ResponseOutcome.rateLimited(
                parseRetryAfter(headers.getFirst(HttpHeaders.RETRY_AFTER)), requestUrl, body == null ? "" : body);
        }

        return ResponseOutcome.failure(statusCode, reasonPhrase, body == null ? UNREADABLE_BODY : body, requestUrl);
    }

    /**
     * Retry-After in whole seconds. Missing, negative or non-numeric values count as zero.
     */
    static long parseRetryAfter(String retryAfter) {
        if (!StringUtils.hasText(retryAfter)) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(retryAfter.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric Retry-After header: {}", retryAfter);
            return 0L;
        }
    }

    private static boolean isReason(String reasonPhrase, String expected, int statusCode, HttpStatus fallback) {
        if (StringUtils.hasText(reasonPhrase)) {
            return expected.equals(reasonPhrase);
        }
        return statusCode == fallback.value();
    }

    /**
     * Body as UTF-8 text, or {@code null} when the stream breaks off mid-read. A truncated body is
     * a malformed response, not a connection failure.
     */
    private static String readBody(ClientHttpResponse response, String requestUrl) {
        try {
            return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read anomaly detector response body from {}: {}", requestUrl, e.getMessage());
            return null;
        }
    }
}
