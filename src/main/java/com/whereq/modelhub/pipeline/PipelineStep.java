package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.model.PredictionOptions;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One stage of a pipeline definition
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineStep {
    /**
     * Display name, derived from kind and operation when absent
     */
    private String name;

    private StepKind kind;

    /**
     * Built-in operation name (preprocess, transform and aggregate steps)
     */
    private String operation;

    /**
     * Model to predict with (predict steps)
     */
    private String modelId;

    /**
     * Parameters of the built-in operation
     */
    private JsonNode params;

    /**
     * Options passed to the prediction (predict steps)
     */
    private PredictionOptions predictionOptions;

    /**
     * User-supplied logic; required for custom steps, overrides the built-in otherwise
     */
    @JsonIgnore
    private StepFunction handler;

    public static PipelineStep preprocess(String operation, JsonNode params) {
        return PipelineStep.builder().kind(StepKind.PREPROCESS).operation(operation).params(params).build();
    }

    public static PipelineStep predict(String modelId) {
        return PipelineStep.builder().kind(StepKind.PREDICT).modelId(modelId).build();
    }

    public static PipelineStep transform(String operation, JsonNode params) {
        return PipelineStep.builder().kind(StepKind.TRANSFORM).operation(operation).params(params).build();
    }

    public static PipelineStep aggregate(String operation, JsonNode params) {
        return PipelineStep.builder().kind(StepKind.AGGREGATE).operation(operation).params(params).build();
    }

    public static PipelineStep custom(String name, StepFunction handler) {
        return PipelineStep.builder().kind(StepKind.CUSTOM).name(name).handler(handler).build();
    }
}
