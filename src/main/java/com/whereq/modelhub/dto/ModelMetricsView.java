package com.whereq.modelhub.dto;

import com.whereq.modelhub.model.ModelMetrics;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time copy of a model's usage metrics
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetricsView {
    private long predictions;

    private double totalInferenceTime;

    private double averageInferenceTime;

    private Instant lastUsed;

    private Double accuracy;

    private Double error;

    public static ModelMetricsView of(ModelMetrics metrics) {
        synchronized (metrics) {
            return ModelMetricsView.builder()
                .predictions(metrics.getPredictionCount())
                .totalInferenceTime(metrics.getCumulativeInferenceTimeMs())
                .averageInferenceTime(metrics.getAverageInferenceTimeMs())
                .lastUsed(metrics.getLastUsedAt())
                .accuracy(metrics.getTrainedAccuracy())
                .error(metrics.getTrainedError())
                .build();
        }
    }
}
