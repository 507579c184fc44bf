package com.whereq.modelhub.model;

/**
 * Computation families a model can belong to. Every kind is served by exactly one
 * {@link com.whereq.modelhub.capability.ModelCapability}.
 */
public enum ModelKind {
    /**
     * Returns its input unchanged
     */
    ECHO,

    /**
     * Linear regression over a numeric feature vector
     */
    LINEAR,

    /**
     * Caller-supplied {@link com.whereq.modelhub.capability.CustomModel}
     */
    CUSTOM
}
