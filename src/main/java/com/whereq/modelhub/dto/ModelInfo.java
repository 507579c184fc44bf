package com.whereq.modelhub.dto;

import com.whereq.modelhub.model.ModelKind;
import com.whereq.modelhub.model.ModelStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Public view of a registered model. Carries no handle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfo {
    private String modelId;

    private ModelKind kind;

    private String version;

    private ModelStatus status;

    private Instant registeredAt;

    /**
     * Load failure message (FAILED models only)
     */
    private String errorMessage;

    private ModelMetricsView metrics;
}
