package com.whereq.modelhub.pipeline;

import com.whereq.modelhub.dto.PipelineMetricsView;

/**
 * Aggregate execution counters of a pipeline
 */
public class PipelineMetrics {

    private long executions;
    private double totalTimeMs;
    private long errors;

    public synchronized void recordSuccess(double elapsedMs) {
        executions++;
        totalTimeMs += elapsedMs;
    }

    public synchronized void recordError() {
        errors++;
    }

    public synchronized PipelineMetricsView toView() {
        return PipelineMetricsView.builder()
            .executions(executions)
            .totalTime(totalTimeMs)
            .errors(errors)
            .build();
    }
}
