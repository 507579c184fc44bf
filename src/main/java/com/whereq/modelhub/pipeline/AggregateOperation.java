package com.whereq.modelhub.pipeline;

/**
 * Built-in aggregate operations
 */
public enum AggregateOperation {
    MEAN,
    ENSEMBLE,
    VOTE
}
