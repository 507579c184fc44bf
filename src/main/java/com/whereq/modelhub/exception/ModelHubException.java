package com.whereq.modelhub.exception;

/**
 * Base class of all errors raised by the model serving core
 */
public abstract class ModelHubException extends RuntimeException {

    protected ModelHubException(String message) {
        super(message);
    }

    protected ModelHubException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getErrorKind();
}
