package com.whereq.modelhub.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate execution metrics of one pipeline
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineMetricsView {
    private long executions;

    private double totalTime;

    private long errors;
}
