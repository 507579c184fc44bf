package com.whereq.modelhub.exception;

/**
 * Error categories reported at the service boundary
 */
public enum ErrorKind {
    NOT_FOUND,
    NOT_READY,
    DUPLICATE_MODEL,
    CAPACITY,
    MODEL_LOAD,
    PREDICTION,
    TRAINING,
    PIPELINE_STEP,
    INVALID_PIPELINE,
    INTERNAL
}
