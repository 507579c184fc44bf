package com.whereq.modelhub.model;

/**
 * Model lifecycle states
 *
 * State transitions:
 * LOADING → READY
 * LOADING → FAILED
 */
public enum ModelStatus {
    /**
     * Handle is being created by the kind's load capability
     */
    LOADING,

    /**
     * Handle loaded, model addressable by other components
     */
    READY,

    /**
     * Load failed, entry kept so lookups report why
     */
    FAILED;

    public boolean isReady() {
        return this == READY;
    }
}
