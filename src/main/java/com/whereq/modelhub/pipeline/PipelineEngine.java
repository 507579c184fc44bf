package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.whereq.modelhub.dto.PipelineMetricsView;
import com.whereq.modelhub.event.EventType;
import com.whereq.modelhub.event.LifecycleEventPublisher;
import com.whereq.modelhub.exception.InvalidPipelineException;
import com.whereq.modelhub.exception.NotFoundException;
import com.whereq.modelhub.exception.PipelineStepException;
import com.whereq.modelhub.prediction.PredictionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates pipelines and runs them, threading one data value through the stages strictly
 * in order
 */
@Slf4j
@Service
public class PipelineEngine {

    @Autowired
    private PredictionService predictionService;

    @Autowired
    private LifecycleEventPublisher eventPublisher;

    @Autowired
    private MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, Pipeline> pipelines = new ConcurrentHashMap<>();

    private final AtomicLong executionSequence = new AtomicLong();

    private Timer executionTimer;

    @PostConstruct
    public void initialize() {
        executionTimer = Timer.builder("modelhub.pipeline.execution.time")
            .description("Pipeline execution time")
            .register(meterRegistry);
    }

    /**
     * Validate and store a pipeline. Model ids of predict steps are resolved at execution time.
     *
     * @param pipelineId pipeline id
     * @param steps steps in execution order
     * @return the stored pipeline
     * @throws InvalidPipelineException if a step is malformed or the id is taken
     */
    public Pipeline createPipeline(String pipelineId, List<PipelineStep> steps) {
        if (pipelineId == null || pipelineId.isBlank()) {
            throw new InvalidPipelineException("Pipeline id is required");
        }
        if (steps == null || steps.isEmpty()) {
            throw new InvalidPipelineException("Pipeline " + pipelineId + " has no steps");
        }

        List<PipelineStage> stages = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            stages.add(validate(pipelineId, i, steps.get(i)));
        }

        Pipeline pipeline = new Pipeline(pipelineId, stages);
        if (pipelines.putIfAbsent(pipelineId, pipeline) != null) {
            throw new InvalidPipelineException("Pipeline already exists: " + pipelineId);
        }

        log.info("Pipeline {} created with {} steps", pipelineId, stages.size());
        return pipeline;
    }

    public Pipeline getPipeline(String pipelineId) {
        Pipeline pipeline = pipelines.get(pipelineId);
        if (pipeline == null) {
            throw NotFoundException.pipeline(pipelineId);
        }
        return pipeline;
    }

    public boolean removePipeline(String pipelineId) {
        boolean removed = pipelines.remove(pipelineId) != null;
        if (removed) {
            log.info("Pipeline {} removed", pipelineId);
        }
        return removed;
    }

    public int size() {
        return pipelines.size();
    }

    public Map<String, PipelineMetricsView> metrics() {
        Map<String, PipelineMetricsView> views = new LinkedHashMap<>();
        pipelines.forEach((id, pipeline) -> views.put(id, pipeline.getMetrics().toView()));
        return views;
    }

    /**
     * Run a pipeline
     *
     * @param pipelineId pipeline id
     * @param input initial data value
     * @param options execution options, may be null
     * @return Mono with the completed execution; errors with {@link PipelineStepException}
     *         when a step fails
     */
    public Mono<PipelineExecution> execute(String pipelineId, JsonNode input, ExecutionOptions options) {
        ExecutionOptions opts = options != null ? options : ExecutionOptions.defaults();

        return Mono.defer(() -> {
            Pipeline pipeline = getPipeline(pipelineId);
            String executionId = "exec_" + pipelineId + "_" + System.currentTimeMillis()
                + "_" + executionSequence.incrementAndGet();
            PipelineExecution execution = PipelineExecution.start(pipeline, executionId);
            long start = System.nanoTime();

            log.debug("Executing pipeline {} as {}", pipelineId, executionId);

            return runFrom(pipeline, execution, 0, input != null ? input : NullNode.getInstance(), opts)
                .map(output -> {
                    double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;

                    execution.setStatus(ExecutionStatus.COMPLETED);
                    execution.setEndTime(Instant.now());
                    execution.setOutput(output);

                    pipeline.getMetrics().recordSuccess(elapsedMs);
                    executionTimer.record(Duration.ofNanos(System.nanoTime() - start));

                    eventPublisher.publish(EventType.PIPELINE_COMPLETED, pipelineId,
                        Map.of("executionId", executionId, "executionTime", elapsedMs));
                    return execution;
                })
                .doOnError(error -> {
                    execution.setStatus(ExecutionStatus.FAILED);
                    execution.setEndTime(Instant.now());
                    execution.setErrorMessage(error.getMessage());

                    pipeline.getMetrics().recordError();

                    log.error("Pipeline {} execution {} failed: {}", pipelineId, executionId, error.getMessage());
                    eventPublisher.publish(EventType.PIPELINE_FAILED, pipelineId,
                        Map.of("executionId", executionId, "error", String.valueOf(error.getMessage())));
                });
        });
    }

    private Mono<JsonNode> runFrom(Pipeline pipeline, PipelineExecution execution, int index, JsonNode data,
                                   ExecutionOptions options) {
        if (index >= pipeline.size()) {
            return Mono.just(data);
        }

        PipelineStage stage = pipeline.getStages().get(index);
        StepResult result = execution.getResults().get(index);

        return Mono.defer(() -> {
                execution.setCurrentStep(index);
                result.setStatus(StepStatus.RUNNING);
                long stepStart = System.nanoTime();

                return executeStage(stage, data, options)
                    .defaultIfEmpty(NullNode.getInstance())
                    .doOnNext(output -> {
                        result.setStatus(StepStatus.COMPLETED);
                        result.setDurationMs((System.nanoTime() - stepStart) / 1_000_000.0);
                        if (options.isIncludeIntermediateResults()) {
                            result.setOutput(output);
                        }
                    });
            })
            // Wrap only this step's failure; later steps wrap their own
            .onErrorMap(error -> {
                result.setStatus(StepStatus.FAILED);
                result.setErrorMessage(error.getMessage());
                for (int i = index + 1; i < execution.getResults().size(); i++) {
                    execution.getResults().get(i).setStatus(StepStatus.SKIPPED);
                }
                return new PipelineStepException(pipeline.getPipelineId(), stage.getName(), index, error);
            })
            .flatMap(output -> runFrom(pipeline, execution, index + 1, output, options));
    }

    private Mono<JsonNode> executeStage(PipelineStage stage, JsonNode data, ExecutionOptions options) {
        StepFunction handler = stage.getHandler();

        if (handler != null && stage.getKind() != StepKind.PREDICT) {
            return Mono.fromCallable(() -> handler.apply(data, options))
                .subscribeOn(Schedulers.boundedElastic());
        }

        return switch (stage.getKind()) {
            case PREPROCESS -> Mono.fromCallable(() ->
                Preprocessors.apply(stage.getPreprocessOperation(), data, stage.params()));
            case PREDICT -> predictionService.predict(stage.getModelId(), data, stage.getPredictionOptions());
            case TRANSFORM -> Mono.fromCallable(() ->
                Transformers.apply(stage.getTransformOperation(), data, stage.params()));
            case AGGREGATE -> Mono.fromCallable(() ->
                Aggregators.apply(stage.getAggregateOperation(), data, stage.params()));
            case CUSTOM -> Mono.error(new IllegalStateException("Custom step without handler: " + stage.getName()));
        };
    }

    private PipelineStage validate(String pipelineId, int index, PipelineStep step) {
        if (step == null || step.getKind() == null) {
            throw new InvalidPipelineException("Step " + index + " of pipeline " + pipelineId + " has no kind");
        }

        // Everything the stage runs with is copied here, the caller keeps its mutable step
        PipelineStage.PipelineStageBuilder stage = PipelineStage.builder()
            .index(index)
            .name(step.getName() != null ? step.getName() : defaultName(step))
            .kind(step.getKind())
            .modelId(step.getModelId())
            .predictionOptions(PipelineStage.copy(step.getPredictionOptions()))
            .params(step.getParams() != null ? step.getParams().deepCopy() : null)
            .handler(step.getHandler());

        boolean builtin = step.getHandler() == null;

        switch (step.getKind()) {
            case PREPROCESS -> {
                if (builtin) {
                    stage.preprocessOperation(parse(PreprocessOperation.class, pipelineId, index, step));
                }
            }
            case TRANSFORM -> {
                if (builtin) {
                    stage.transformOperation(parse(TransformOperation.class, pipelineId, index, step));
                }
            }
            case AGGREGATE -> {
                if (builtin) {
                    stage.aggregateOperation(parse(AggregateOperation.class, pipelineId, index, step));
                }
            }
            case PREDICT -> {
                if (step.getModelId() == null || step.getModelId().isBlank()) {
                    throw new InvalidPipelineException("Predict step " + index + " of pipeline " + pipelineId
                        + " has no modelId");
                }
            }
            case CUSTOM -> {
                if (builtin) {
                    throw new InvalidPipelineException("Custom step " + index + " of pipeline " + pipelineId
                        + " has no handler");
                }
            }
        }

        return stage.build();
    }

    private static <E extends Enum<E>> E parse(Class<E> operations, String pipelineId, int index, PipelineStep step) {
        String operation = step.getOperation();
        if (operation == null || operation.isBlank()) {
            throw new InvalidPipelineException("Step " + index + " of pipeline " + pipelineId
                + " needs an operation or a handler");
        }
        try {
            return Enum.valueOf(operations, operation.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidPipelineException("Unknown " + step.getKind().name().toLowerCase(Locale.ROOT)
                + " operation '" + operation + "' in step " + index + " of pipeline " + pipelineId);
        }
    }

    private static String defaultName(PipelineStep step) {
        String kind = step.getKind().name().toLowerCase(Locale.ROOT);
        if (step.getKind() == StepKind.PREDICT) {
            return kind + ":" + step.getModelId();
        }
        return step.getOperation() != null ? kind + ":" + step.getOperation() : kind;
    }
}
