package com.whereq.modelhub.pipeline;

/**
 * Built-in transform operations
 */
public enum TransformOperation {
    RESHAPE,
    FILTER,
    MAP
}
