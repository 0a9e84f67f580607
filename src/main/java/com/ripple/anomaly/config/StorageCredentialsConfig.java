package com.ripple.anomaly.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import lombok.Data;

/**
 * Blob storage credentials for the container holding anomaly detector training data.
 * Values come from the environment; there are no built-in defaults.
 */
@Data
@Configuration
public class StorageCredentialsConfig {
    static final String MISSING_BLOB_ACCESS_MESSAGE =
        "You need to set either {connectionString, containerName} " +
        "or {storageName, storageKey, endpoint, sasToken, containerName} in order to access the blob container";

    @Value("${storage.connection-string:}")
    private String connectionString;

    @Value("${storage.name:}")
    private String storageName;

    @Value("${storage.key:}")
    private String storageKey;

    @Value("${storage.endpoint:}")
    private String endpoint;

    @Value("${storage.sas-token:}")
    private String sasToken;

    @Value("${storage.container-name:}")
    private String containerName;

    public boolean usesConnectionString() {
        return StringUtils.hasText(connectionString) && StringUtils.hasText(containerName);
    }

    public boolean usesAccountCredentials() {
        return StringUtils.hasText(storageName)
            && StringUtils.hasText(storageKey)
            && StringUtils.hasText(endpoint)
            && StringUtils.hasText(sasToken)
            && StringUtils.hasText(containerName);
    }

    /**
     * @throws IllegalArgumentException if neither credential set is complete
     */
    public void validateBlobAccess() {
        if (!usesConnectionString() && !usesAccountCredentials()) {
            throw new IllegalArgumentException(MISSING_BLOB_ACCESS_MESSAGE);
        }
    }

    @Override
    public String toString() {
        // Secrets stay out of logs.
        return "StorageCredentialsConfig(storageName=" + storageName
            + ", endpoint=" + endpoint
            + ", containerName=" + containerName
            + ", connectionString=" + mask(connectionString)
            + ", storageKey=" + mask(storageKey)
            + ", sasToken=" + mask(sasToken) + ")";
    }

    private static String mask(String secret) {
        return StringUtils.hasText(secret) ? "****" : "";
    }
}
