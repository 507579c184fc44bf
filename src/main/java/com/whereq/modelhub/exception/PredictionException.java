package com.whereq.modelhub.exception;

import lombok.Getter;

/**
 * Exception thrown when preprocessing, inference or postprocessing fails
 */
@Getter
public class PredictionException extends ModelHubException {

    private final String modelId;

    public PredictionException(String modelId, Throwable cause) {
        super("Prediction failed for model " + modelId + ": " + cause.getMessage(), cause);
        this.modelId = modelId;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.PREDICTION;
    }
}
