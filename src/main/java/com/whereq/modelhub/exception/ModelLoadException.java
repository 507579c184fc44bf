package com.whereq.modelhub.exception;

import lombok.Getter;

/**
 * Exception thrown when a model kind fails to load its handle
 */
@Getter
public class ModelLoadException extends ModelHubException {

    private final String modelId;

    public ModelLoadException(String modelId, Throwable cause) {
        super("Failed to load model " + modelId + ": " + cause.getMessage(), cause);
        this.modelId = modelId;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.MODEL_LOAD;
    }
}
