package com.whereq.modelhub.pipeline;

import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * Immutable, ordered sequence of stages. Stage order is the only execution order.
 */
@Getter
public class Pipeline {

    private final String pipelineId;

    private final List<PipelineStage> stages;

    private final Instant createdAt = Instant.now();

    private final PipelineMetrics metrics = new PipelineMetrics();

    public Pipeline(String pipelineId, List<PipelineStage> stages) {
        this.pipelineId = pipelineId;
        this.stages = List.copyOf(stages);
    }

    public int size() {
        return stages.size();
    }
}
