package com.whereq.modelhub.exception;

import lombok.Getter;

/**
 * Wraps the error of the pipeline step that halted an execution
 */
@Getter
public class PipelineStepException extends ModelHubException {

    private final String pipelineId;
    private final String stepName;
    private final int stepIndex;

    public PipelineStepException(String pipelineId, String stepName, int stepIndex, Throwable cause) {
        super("Pipeline " + pipelineId + " failed at step " + stepIndex + " (" + stepName + "): "
            + cause.getMessage(), cause);
        this.pipelineId = pipelineId;
        this.stepName = stepName;
        this.stepIndex = stepIndex;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.PIPELINE_STEP;
    }
}
