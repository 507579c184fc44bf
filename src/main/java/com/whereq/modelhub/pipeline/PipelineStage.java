package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.model.PredictionOptions;
import lombok.Builder;
import lombok.Getter;

/**
 * A validated step fixed at its position in a pipeline. Holds its own copies of the step
 * definition, so later changes to the caller's {@link PipelineStep} do not reach it.
 * Exactly one operation field is set for preprocess, transform and aggregate steps
 * without a handler.
 */
@Getter
@Builder
public class PipelineStage {
    private final int index;

    private final String name;

    private final StepKind kind;

    private final String modelId;

    private final PredictionOptions predictionOptions;

    private final JsonNode params;

    private final StepFunction handler;

    private final PreprocessOperation preprocessOperation;

    private final TransformOperation transformOperation;

    private final AggregateOperation aggregateOperation;

    /**
     * Copy of the parameters; the stored one is only read by built-in operations
     */
    public JsonNode getParams() {
        return params != null ? params.deepCopy() : null;
    }

    JsonNode params() {
        return params;
    }

    public PredictionOptions getPredictionOptions() {
        return copy(predictionOptions);
    }

    static PredictionOptions copy(PredictionOptions options) {
        if (options == null) {
            return null;
        }
        return PredictionOptions.builder()
            .cache(options.isCache())
            .cacheTtl(options.getCacheTtl())
            .build();
    }
}
