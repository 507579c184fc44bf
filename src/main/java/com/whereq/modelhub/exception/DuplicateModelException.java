package com.whereq.modelhub.exception;

import lombok.Getter;

/**
 * Exception thrown when registering a model id that is already ready or still loading
 */
@Getter
public class DuplicateModelException extends ModelHubException {

    private final String modelId;

    public DuplicateModelException(String modelId) {
        super("Model already registered: " + modelId);
        this.modelId = modelId;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.DUPLICATE_MODEL;
    }
}
