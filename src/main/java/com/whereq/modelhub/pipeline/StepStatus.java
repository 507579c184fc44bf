package com.whereq.modelhub.pipeline;

/**
 * Status of a step within one execution
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    /**
     * Not run because an earlier step failed
     */
    SKIPPED
}
