package com.whereq.modelhub.pipeline;

/**
 * Built-in preprocess operations
 */
public enum PreprocessOperation {
    NORMALIZE,
    TOKENIZE,
    VECTORIZE
}
