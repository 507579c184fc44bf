package com.whereq.modelhub.pipeline;

/**
 * Status of a pipeline execution
 */
public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
