package com.ripple.anomaly.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import lombok.Data;
import lombok.ToString;

@Data
@Configuration
public class AnomalyDetectorConfig {
    @ToString.Exclude
    @Value("${anomaly-detector.subscription-key}")
    private String subscriptionKey;

    @Value("${anomaly-detector.location:westus2}")
    private String location;

    @Value("${anomaly-detector.endpoint:}")
    private String endpoint;

    @Value("${anomaly-detector.timeout.connect:5000}")
    private int connectTimeout;

    @Value("${anomaly-detector.timeout.read:10000}")
    private int readTimeout;

    @Value("${anomaly-detector.retry.backoff-ms:100,500,1000}")
    private long[] retryBackoffMs;

    /**
     * Base URL of the vendor service: the explicit endpoint when configured,
     * otherwise the regional endpoint derived from {@link #location}.
     */
    public String getServiceUrl() {
        String base = StringUtils.hasText(endpoint)
            ? endpoint
            : String.format("https://%s.api.cognitive.microsoft.com", location);
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
