package com.whereq.modelhub.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options for a training run. Unset numeric options fall back to the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingOptions {
    private Integer epochs;

    private Double learningRate;

    /**
     * Persist the model through the artifact store after a successful run
     */
    private boolean save;

    /**
     * Artifact path to save to, defaults to {@code <modelId>/model.json}
     */
    private String savePath;

    private Notifications notifications;

    public static TrainingOptions defaults() {
        return TrainingOptions.builder().build();
    }
}
