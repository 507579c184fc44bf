package com.whereq.modelhub.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One run of a training operation against a model. Fields are written by the training
 * thread and read by observers, so every field is volatile and {@link #snapshot()} is
 * what leaves the job manager.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrainingJob {
    private volatile String jobId;

    private volatile String modelId;

    private volatile TrainingJobStatus status;

    /**
     * Percentage complete, 0 to 100
     */
    private volatile double progress;

    /**
     * Latest reported metrics
     */
    private volatile Map<String, Double> metrics;

    private volatile TrainingResult result;

    private volatile String errorMessage;

    private volatile Instant startTime;

    private volatile Instant endTime;

    public TrainingJob snapshot() {
        return toBuilder().build();
    }
}
