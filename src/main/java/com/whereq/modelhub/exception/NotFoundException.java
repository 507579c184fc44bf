package com.whereq.modelhub.exception;

import lombok.Getter;

/**
 * Exception thrown when a model, pipeline or training job id is unknown
 */
@Getter
public class NotFoundException extends ModelHubException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static NotFoundException model(String modelId) {
        return new NotFoundException("Model", modelId);
    }

    public static NotFoundException pipeline(String pipelineId) {
        return new NotFoundException("Pipeline", pipelineId);
    }

    public static NotFoundException job(String jobId) {
        return new NotFoundException("Training job", jobId);
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.NOT_FOUND;
    }
}
