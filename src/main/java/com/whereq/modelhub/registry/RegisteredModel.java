package com.whereq.modelhub.registry;

import com.whereq.modelhub.dto.ModelInfo;
import com.whereq.modelhub.dto.ModelMetricsView;
import com.whereq.modelhub.model.ModelConfig;
import com.whereq.modelhub.model.ModelKind;
import com.whereq.modelhub.model.ModelMetrics;
import com.whereq.modelhub.model.ModelStatus;

import java.time.Instant;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry entry. Owns the model handle; the handle never leaves the registry except
 * into a capability call made under {@link #usageLock}.
 */
class RegisteredModel {

    private final String modelId;
    private final ModelConfig config;
    private final Instant registeredAt = Instant.now();
    private final ModelMetrics metrics = new ModelMetrics();

    /**
     * Read lock held while the handle is in use, write lock held while disposing it
     */
    private final ReadWriteLock usageLock = new ReentrantReadWriteLock();

    private volatile ModelStatus status = ModelStatus.LOADING;
    private volatile Object handle;
    private volatile String errorMessage;

    RegisteredModel(String modelId, ModelConfig config) {
        this.modelId = modelId;
        this.config = config;
    }

    void markReady(Object loadedHandle) {
        if (loadedHandle == null) {
            throw new IllegalStateException("Capability returned a null handle for " + modelId);
        }
        this.handle = loadedHandle;
        this.status = ModelStatus.READY;
    }

    void markFailed(String message) {
        this.errorMessage = message;
        this.status = ModelStatus.FAILED;
    }

    /**
     * Detach the handle for disposal
     */
    Object releaseHandle() {
        Object released = handle;
        handle = null;
        return released;
    }

    String getModelId() {
        return modelId;
    }

    ModelKind getKind() {
        return config.getKind();
    }

    ModelConfig getConfig() {
        return config;
    }

    ModelStatus getStatus() {
        return status;
    }

    Object getHandle() {
        return handle;
    }

    ModelMetrics getMetrics() {
        return metrics;
    }

    ReadWriteLock getUsageLock() {
        return usageLock;
    }

    ModelInfo toInfo() {
        return ModelInfo.builder()
            .modelId(modelId)
            .kind(config.getKind())
            .version(config.getVersion())
            .status(status)
            .registeredAt(registeredAt)
            .errorMessage(errorMessage)
            .metrics(ModelMetricsView.of(metrics))
            .build();
    }
}
