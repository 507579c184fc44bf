package com.whereq.modelhub.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.capability.CustomModel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.function.Supplier;

/**
 * Registration request for a model
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelConfig {
    /**
     * Computation family, selects the capability used to load and run the model
     */
    private ModelKind kind;

    /**
     * Model version label
     */
    @Builder.Default
    private String version = "1.0.0";

    /**
     * Artifact store path to load the model from (optional)
     */
    private String artifactPath;

    /**
     * Kind-specific parameters (weights, input size, ...)
     */
    private JsonNode params;

    /**
     * Loader for CUSTOM models
     */
    @JsonIgnore
    private Supplier<CustomModel> loader;
}
