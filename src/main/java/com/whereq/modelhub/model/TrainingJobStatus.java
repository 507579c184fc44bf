package com.whereq.modelhub.model;

/**
 * Training job lifecycle states
 *
 * State transitions:
 * PREPARING → PREPROCESSING → TRAINING → {COMPLETED, FAILED}
 * any non-terminal state → FAILED
 */
public enum TrainingJobStatus {
    PREPARING,
    PREPROCESSING,
    TRAINING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
