package com.ripple.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ListModelsResponse {
    @Builder.Default
    private List<ModelSummary> models = new ArrayList<>();
    private int currentCount;
    private int maxCount;
    private String nextLink;

    @JsonIgnore
    public boolean hasNextLink() {
        return nextLink != null && !nextLink.isBlank();
    }
}
