package com.whereq.modelhub.exception;

import lombok.Getter;

/**
 * Exception thrown when a training job fails after it has started
 */
@Getter
public class TrainingException extends ModelHubException {

    private final String modelId;
    private final String jobId;

    public TrainingException(String modelId, String jobId, Throwable cause) {
        super("Training job " + jobId + " failed for model " + modelId + ": " + cause.getMessage(), cause);
        this.modelId = modelId;
        this.jobId = jobId;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.TRAINING;
    }
}
