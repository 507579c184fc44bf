package com.whereq.modelhub.exception;

import com.whereq.modelhub.model.ModelStatus;
import lombok.Getter;

/**
 * Exception thrown when a model exists but is not in READY status
 */
@Getter
public class NotReadyException extends ModelHubException {

    private final String modelId;
    private final ModelStatus status;

    public NotReadyException(String modelId, ModelStatus status) {
        super("Model not ready: " + modelId + " (status " + status + ")");
        this.modelId = modelId;
        this.status = status;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.NOT_READY;
    }
}
