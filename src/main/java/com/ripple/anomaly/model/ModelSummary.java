package com.ripple.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelSummary {
    private String modelId;
    private String createdTime;
    private String lastUpdatedTime;
    private String status;
    private String displayName;
    private int variablesCount;
}
