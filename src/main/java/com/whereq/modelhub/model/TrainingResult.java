package com.whereq.modelhub.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Final outcome reported by a kind's training capability
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainingResult {
    private Double accuracy;

    private Double error;

    private int iterations;

    /**
     * Last reported metrics (loss, ...)
     */
    private Map<String, Double> metrics;
}
