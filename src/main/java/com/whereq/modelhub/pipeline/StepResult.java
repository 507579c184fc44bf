package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one step within an execution
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepResult {
    private int index;

    private String step;

    @Builder.Default
    private StepStatus status = StepStatus.PENDING;

    /**
     * Step output, only kept when intermediate results were requested
     */
    private JsonNode output;

    private double durationMs;

    private String errorMessage;
}
