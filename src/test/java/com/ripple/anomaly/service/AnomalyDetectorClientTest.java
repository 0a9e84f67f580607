package com.ripple.anomaly.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ripple.anomaly.config.AnomalyDetectorConfig;
import com.ripple.anomaly.exception.AnomalyDetectorException;
import com.ripple.anomaly.exception.FailureKind;
import com.ripple.anomaly.model.AnomalyDetectorRequest;
import com.ripple.anomaly.model.ListModelsResponse;
import com.ripple.anomaly.model.ModelSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectorClientTest {

    private static final String MODELS_URL =
        "https://test-anomaly.example.com/anomalydetector/v1.1-preview/multivariate/models";

    @Mock
    private ResilientRequestExecutor requestExecutor;

    private AnomalyDetectorClient anomalyDetectorClient;

    @BeforeEach
    void setUp() {
        AnomalyDetectorConfig config = new AnomalyDetectorConfig();
        config.setEndpoint("https://test-anomaly.example.com/");
        anomalyDetectorClient = new AnomalyDetectorClient(requestExecutor, config, new ObjectMapper());
    }

    @Test
    void testListModels_EmptyResponse() {
        // Given
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL), anyMap()))
            .thenReturn("{\"models\":[], \"currentCount\":0,\"maxCount\":100}");

        // When
        ListModelsResponse response = anomalyDetectorClient.listModels();

        // Then
        assertTrue(response.getModels().isEmpty());
        assertEquals(0, response.getCurrentCount());
        assertEquals(100, response.getMaxCount());
        assertNull(response.getNextLink());
        assertFalse(response.hasNextLink());
        verify(requestExecutor).execute(argThat(r -> r.getMethod() == HttpMethod.GET && !r.hasBody()),
            eq(MODELS_URL), eq(Collections.emptyMap()));
    }

    @Test
    void testListModels_DecodesModelsAndIgnoresUnknownFields() {
        // Given
        String body = "{\"models\":[{\"modelId\":\"m-1\",\"createdTime\":\"2021-01-01T00:00:00Z\","
            + "\"lastUpdatedTime\":\"2021-01-01T00:05:00Z\",\"status\":\"READY\",\"displayName\":\"sensors\","
            + "\"variablesCount\":3,\"errors\":[]},"
            + "{\"modelId\":\"m-2\",\"createdTime\":\"2021-01-02T00:00:00Z\","
            + "\"lastUpdatedTime\":\"2021-01-02T00:05:00Z\",\"status\":\"FAILED\",\"variablesCount\":0}],"
            + "\"currentCount\":2,\"maxCount\":300,\"nextLink\":\"\"}";
        Map<String, String> params = Map.of("$top", "2");
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL), eq(params))).thenReturn(body);

        // When
        ListModelsResponse response = anomalyDetectorClient.listModels(params);

        // Then
        assertEquals(2, response.getModels().size());
        ModelSummary first = response.getModels().get(0);
        assertEquals("m-1", first.getModelId());
        assertEquals("READY", first.getStatus());
        assertEquals("sensors", first.getDisplayName());
        assertEquals(3, first.getVariablesCount());
        assertNull(response.getModels().get(1).getDisplayName());
        assertFalse(response.hasNextLink());
    }

    @Test
    void testListModels_InvalidJson() {
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL), anyMap()))
            .thenReturn("<html>Service Unavailable</html>");

        AnomalyDetectorException exception = assertThrows(AnomalyDetectorException.class,
            () -> anomalyDetectorClient.listModels());

        assertEquals(FailureKind.MALFORMED_RESPONSE, exception.getKind());
        assertTrue(exception.getMessage().contains("Invalid response from anomaly detector"));
    }

    @Test
    void testListModelsRaw_ReturnsBodyUnchanged() {
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL), anyMap()))
            .thenReturn("{\"models\":[]}");

        assertEquals("{\"models\":[]}", anomalyDetectorClient.listModelsRaw(Collections.emptyMap()));
    }

    @Test
    void testListAllModels_FollowsNextLink() {
        // Given
        String nextLink = MODELS_URL + "?$skip=1&$top=1";
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL), anyMap()))
            .thenReturn("{\"models\":[{\"modelId\":\"m-1\",\"status\":\"READY\",\"variablesCount\":3}],"
                + "\"currentCount\":2,\"maxCount\":300,\"nextLink\":\"" + nextLink + "\"}");
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(nextLink), anyMap()))
            .thenReturn("{\"models\":[{\"modelId\":\"m-2\",\"status\":\"READY\",\"variablesCount\":3}],"
                + "\"currentCount\":2,\"maxCount\":300}");

        // When
        List<ModelSummary> models = anomalyDetectorClient.listAllModels();

        // Then
        assertEquals(2, models.size());
        assertEquals("m-1", models.get(0).getModelId());
        assertEquals("m-2", models.get(1).getModelId());
        verify(requestExecutor).execute(any(AnomalyDetectorRequest.class), eq(nextLink), eq(Collections.emptyMap()));
    }

    @Test
    void testListAllModels_StopsOnRepeatedNextLink() {
        // Given - the service keeps returning the same link
        String nextLink = MODELS_URL + "?$skip=1&$top=1";
        String page = "{\"models\":[{\"modelId\":\"m-1\"}],\"currentCount\":1,\"maxCount\":300,"
            + "\"nextLink\":\"" + nextLink + "\"}";
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), anyString(), anyMap())).thenReturn(page);

        // When
        List<ModelSummary> models = anomalyDetectorClient.listAllModels();

        // Then
        assertEquals(2, models.size());
        verify(requestExecutor, times(1)).execute(any(AnomalyDetectorRequest.class), eq(nextLink), anyMap());
    }

    @Test
    void testDeleteModel_Success() {
        // Given
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL + "/m-1"), anyMap()))
            .thenReturn("");

        // When
        String result = anomalyDetectorClient.deleteModel("m-1");

        // Then
        assertEquals("", result);
        verify(requestExecutor).execute(argThat(r -> r.getMethod() == HttpMethod.DELETE),
            eq(MODELS_URL + "/m-1"), eq(Collections.emptyMap()));
    }

    @Test
    void testDeleteModel_ModelNotExist() {
        // Given
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL + "/FAKE_MODEL_ID"), anyMap()))
            .thenThrow(new AnomalyDetectorException(FailureKind.HTTP_STATUS,
                "Failed: response: 404 Not Found {\"code\":\"ModelNotExist\"} requestUrl: " + MODELS_URL + "/FAKE_MODEL_ID",
                404, MODELS_URL + "/FAKE_MODEL_ID", "{\"code\":\"ModelNotExist\"}"));

        // When & Then
        AnomalyDetectorException exception = assertThrows(AnomalyDetectorException.class,
            () -> anomalyDetectorClient.deleteModel("FAKE_MODEL_ID"));
        assertTrue(exception.getMessage().contains("ModelNotExist"));
    }

    @Test
    void testDeleteModel_BlankId() {
        assertThrows(IllegalArgumentException.class, () -> anomalyDetectorClient.deleteModel(" "));
        verifyNoInteractions(requestExecutor);
    }

    @Test
    void testDeleteModels_BlankIdDoesNotAbortCleanup() {
        // Given
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL + "/m-1"), anyMap()))
            .thenReturn("");
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL + "/m-3"), anyMap()))
            .thenReturn("");

        // When
        List<String> failed = anomalyDetectorClient.deleteModels(Arrays.asList("m-1", "", null, "m-3"));

        // Then
        assertEquals(Arrays.asList("", null), failed);
        verify(requestExecutor).execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL + "/m-3"), anyMap());
        verify(requestExecutor, times(2)).execute(any(AnomalyDetectorRequest.class), anyString(), anyMap());
    }

    @Test
    void testDeleteModels_ContinuesPastFailures() {
        // Given
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL + "/m-1"), anyMap()))
            .thenReturn("");
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL + "/m-2"), anyMap()))
            .thenThrow(new AnomalyDetectorException(FailureKind.HTTP_STATUS, "Failed: response: 404 Not Found",
                404, MODELS_URL + "/m-2", "{\"code\":\"ModelNotExist\"}"));
        when(requestExecutor.execute(any(AnomalyDetectorRequest.class), eq(MODELS_URL + "/m-3"), anyMap()))
            .thenReturn("");

        // When
        List<String> failed = anomalyDetectorClient.deleteModels(Arrays.asList("m-1", "m-2", "m-3"));

        // Then
        assertEquals(Collections.singletonList("m-2"), failed);
        verify(requestExecutor, times(3)).execute(any(AnomalyDetectorRequest.class), anyString(), anyMap());
    }
}
