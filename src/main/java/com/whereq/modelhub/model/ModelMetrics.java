package com.whereq.modelhub.model;

import java.time.Instant;

/**
 * Per-model usage counters. Mutated only through the registry.
 */
public class ModelMetrics {

    private long predictionCount;
    private double cumulativeInferenceTimeMs;
    private Instant lastUsedAt;
    private Double trainedAccuracy;
    private Double trainedError;

    public synchronized void recordUsage(long count, double inferenceTimeMs) {
        predictionCount += count;
        cumulativeInferenceTimeMs += inferenceTimeMs;
        lastUsedAt = Instant.now();
    }

    public synchronized void recordTraining(Double accuracy, Double error) {
        trainedAccuracy = accuracy;
        trainedError = error;
    }

    public synchronized long getPredictionCount() {
        return predictionCount;
    }

    public synchronized double getCumulativeInferenceTimeMs() {
        return cumulativeInferenceTimeMs;
    }

    public synchronized Instant getLastUsedAt() {
        return lastUsedAt;
    }

    public synchronized Double getTrainedAccuracy() {
        return trainedAccuracy;
    }

    public synchronized Double getTrainedError() {
        return trainedError;
    }

    public synchronized double getAverageInferenceTimeMs() {
        return predictionCount > 0 ? cumulativeInferenceTimeMs / predictionCount : 0.0;
    }
}
