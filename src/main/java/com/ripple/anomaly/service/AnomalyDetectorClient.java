package com.ripple.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ripple.anomaly.config.AnomalyDetectorConfig;
import com.ripple.anomaly.exception.AnomalyDetectorException;
import com.ripple.anomaly.exception.FailureKind;
import com.ripple.anomaly.model.AnomalyDetectorRequest;
import com.ripple.anomaly.model.ListModelsResponse;
import com.ripple.anomaly.model.ModelSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Client for the multivariate model endpoints of the anomaly detector service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetectorClient {

    static final String MODELS_PATH = "/anomalydetector/v1.1-preview/multivariate/models";

    private final ResilientRequestExecutor requestExecutor;
    private final AnomalyDetectorConfig anomalyDetectorConfig;
    private final ObjectMapper objectMapper;

    public String deleteModel(String modelId) {
        return deleteModel(modelId, Collections.emptyMap());
    }

    /**
     * Deletes a trained model.
     *
     * @param modelId id of the model to delete
     * @param params  extra query parameters
     * @return the service response, normally empty
     * @throws AnomalyDetectorException if the model cannot be deleted; a missing model reports {@code ModelNotExist}
     */
    public String deleteModel(String modelId, Map<String, String> params) {
        String url = modelUrl(modelId);
        log.info("Deleting anomaly detector model {}", modelId);
        return requestExecutor.execute(AnomalyDetectorRequest.delete(), url, params);
    }

    /**
     * Deletes every model in {@code modelIds}, carrying on past individual failures.
     *
     * @return ids of the models that could not be deleted
     */
    public List<String> deleteModels(Collection<String> modelIds) {
        List<String> failed = new ArrayList<>();
        for (String modelId : modelIds) {
            try {
                deleteModel(modelId);
            } catch (AnomalyDetectorException | IllegalArgumentException e) {
                log.warn("Could not delete anomaly detector model {}: {}", modelId, e.getMessage());
                failed.add(modelId);
            }
        }
        if (!failed.isEmpty()) {
            log.error("Failed to delete {} of {} anomaly detector models: {}", failed.size(), modelIds.size(), failed);
        }
        return failed;
    }

    public String listModelsRaw(Map<String, String> params) {
        return requestExecutor.execute(AnomalyDetectorRequest.get(), modelsUrl(), params);
    }

    public ListModelsResponse listModels() {
        return listModels(Collections.emptyMap());
    }

    /**
     * Lists one page of models.
     *
     * @param params paging parameters such as {@code $skip} and {@code $top}
     */
    public ListModelsResponse listModels(Map<String, String> params) {
        String url = modelsUrl();
        return decode(requestExecutor.execute(AnomalyDetectorRequest.get(), url, params), url);
    }

    /**
     * Lists all models, following {@code nextLink} until the last page.
     */
    public List<ModelSummary> listAllModels() {
        ListModelsResponse page = listModels();
        List<ModelSummary> models = new ArrayList<>(modelsOf(page));
        Set<String> visited = new HashSet<>();

        while (page.hasNextLink()) {
            String nextLink = page.getNextLink();
            if (!visited.add(nextLink)) {
                log.warn("Stopping model listing: nextLink {} was already visited", nextLink);
                break;
            }
            page = decode(requestExecutor.execute(AnomalyDetectorRequest.get(), nextLink, Collections.emptyMap()), nextLink);
            models.addAll(modelsOf(page));
        }

        log.info("Listed {} anomaly detector models", models.size());
        return models;
    }

    String modelsUrl() {
        return anomalyDetectorConfig.getServiceUrl() + MODELS_PATH;
    }

    String modelUrl(String modelId) {
        if (!StringUtils.hasText(modelId)) {
            throw new IllegalArgumentException("modelId must not be blank");
        }
        return UriComponentsBuilder.fromUriString(modelsUrl())
            .pathSegment(modelId)
            .build()
            .encode()
            .toUriString();
    }

    private ListModelsResponse decode(String body, String url) {
        try {
            return objectMapper.readValue(body, ListModelsResponse.class);
        } catch (JsonProcessingException e) {
            log.error("Invalid list-models response from {}: {}", url, e.getOriginalMessage());
            throw new AnomalyDetectorException(FailureKind.MALFORMED_RESPONSE,
                "Invalid response from anomaly detector: " + e.getOriginalMessage() + " requestUrl: " + url, url, e);
        }
    }

    private static List<ModelSummary> modelsOf(ListModelsResponse page) {
        return page.getModels() == null ? Collections.emptyList() : page.getModels();
    }
}
