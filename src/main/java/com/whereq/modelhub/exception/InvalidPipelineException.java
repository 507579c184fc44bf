package com.whereq.modelhub.exception;

/**
 * Exception thrown when a pipeline definition is rejected at creation time
 */
public class InvalidPipelineException extends ModelHubException {
    public InvalidPipelineException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.INVALID_PIPELINE;
    }
}
