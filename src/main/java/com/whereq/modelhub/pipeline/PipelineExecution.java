package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Record of one pipeline run. Not retained by the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineExecution {
    private String executionId;

    private String pipelineId;

    private ExecutionStatus status;

    /**
     * Index of the step running or last run
     */
    private int currentStep;

    @Builder.Default
    private List<StepResult> results = new ArrayList<>();

    private JsonNode output;

    private String errorMessage;

    private Instant startTime;

    private Instant endTime;

    static PipelineExecution start(Pipeline pipeline, String executionId) {
        List<StepResult> results = new ArrayList<>(pipeline.size());
        for (PipelineStage stage : pipeline.getStages()) {
            results.add(StepResult.builder()
                .index(stage.getIndex())
                .step(stage.getName())
                .build());
        }

        return PipelineExecution.builder()
            .executionId(executionId)
            .pipelineId(pipeline.getPipelineId())
            .status(ExecutionStatus.RUNNING)
            .results(results)
            .startTime(Instant.now())
            .build();
    }
}
