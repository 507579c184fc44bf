package com.whereq.modelhub.pipeline;

/**
 * Kinds of pipeline step
 */
public enum StepKind {
    PREPROCESS,
    PREDICT,
    TRANSFORM,
    AGGREGATE,
    CUSTOM
}
