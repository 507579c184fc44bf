package com.whereq.modelhub.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Snapshot returned by {@code getMetrics}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HubMetrics {
    private long totalPredictions;

    private long totalTrainingJobs;

    /**
     * Mean inference time over all predictions, in milliseconds
     */
    private double averageInferenceTime;

    private Map<String, ModelInfo> models;

    private int activeJobs;

    private int totalModels;

    private int totalPipelines;

    private int pendingInferences;

    private Map<String, PipelineMetricsView> pipelines;
}
