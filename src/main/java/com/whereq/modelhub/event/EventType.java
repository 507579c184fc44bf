package com.whereq.modelhub.event;

/**
 * Lifecycle events emitted by the serving core
 */
public enum EventType {
    MODEL_REGISTERED("model:registered"),
    MODEL_UNREGISTERED("model:unregistered"),
    MODEL_FAILED("model:failed"),
    PREDICTION_COMPLETE("prediction:complete"),
    PREDICTION_ERROR("prediction:error"),
    PIPELINE_COMPLETED("pipeline:completed"),
    PIPELINE_FAILED("pipeline:failed"),
    TRAINING_STARTED("training:started"),
    TRAINING_PROGRESS("training:progress"),
    TRAINING_COMPLETED("training:completed"),
    TRAINING_FAILED("training:failed"),
    BATCH_COMPLETED("batch:completed"),
    BATCH_FAILED("batch:failed");

    private final String eventName;

    EventType(String eventName) {
        this.eventName = eventName;
    }

    /**
     * Name used in logs and metric tags, e.g. {@code training:progress}
     */
    public String eventName() {
        return eventName;
    }
}
