package com.whereq.modelhub.exception;

/**
 * Exception thrown when the training concurrency cap is reached
 */
public class CapacityException extends ModelHubException {
    public CapacityException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.CAPACITY;
    }
}
