package com.whereq.modelhub.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Options for a single prediction
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionOptions {
    /**
     * Serve from and store into the prediction cache
     */
    private boolean cache;

    /**
     * Cache entry lifetime; the configured default applies when null
     */
    private Duration cacheTtl;

    public static PredictionOptions defaults() {
        return PredictionOptions.builder().build();
    }

    public static PredictionOptions cached() {
        return PredictionOptions.builder().cache(true).build();
    }
}
