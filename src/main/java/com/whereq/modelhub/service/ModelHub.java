package com.whereq.modelhub.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.cache.PredictionCache;
import com.whereq.modelhub.dto.HubMetrics;
import com.whereq.modelhub.dto.ModelInfo;
import com.whereq.modelhub.event.LifecycleEvent;
import com.whereq.modelhub.event.LifecycleEventPublisher;
import com.whereq.modelhub.model.ModelConfig;
import com.whereq.modelhub.model.PredictionOptions;
import com.whereq.modelhub.model.TrainingJob;
import com.whereq.modelhub.model.TrainingOptions;
import com.whereq.modelhub.pipeline.ExecutionOptions;
import com.whereq.modelhub.pipeline.Pipeline;
import com.whereq.modelhub.pipeline.PipelineEngine;
import com.whereq.modelhub.pipeline.PipelineExecution;
import com.whereq.modelhub.pipeline.PipelineStep;
import com.whereq.modelhub.prediction.DataProcessor;
import com.whereq.modelhub.prediction.PredictionService;
import com.whereq.modelhub.queue.BatchInferenceQueue;
import com.whereq.modelhub.registry.ModelRegistry;
import com.whereq.modelhub.training.TrainingDataPreparer;
import com.whereq.modelhub.training.TrainingJobManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the core: one instance per application, injected wherever the
 * registry, pipelines, training or the batch queue are needed.
 */
@Slf4j
@Service
public class ModelHub {

    @Autowired
    private ModelRegistry registry;

    @Autowired
    private PredictionService predictionService;

    @Autowired
    private PredictionCache predictionCache;

    @Autowired
    private PipelineEngine pipelineEngine;

    @Autowired
    private TrainingJobManager trainingJobManager;

    @Autowired
    private BatchInferenceQueue batchQueue;

    @Autowired
    private LifecycleEventPublisher eventPublisher;

    public Mono<ModelInfo> registerModel(String modelId, ModelConfig config) {
        return registry.register(modelId, config);
    }

    /**
     * Unload a model and drop its cached predictions
     */
    public Mono<Void> unregisterModel(String modelId) {
        return registry.unregister(modelId)
            .then(Mono.defer(() -> predictionCache.evictModel(modelId)
                .onErrorResume(e -> {
                    log.warn("Failed to evict cached predictions of model {}: {}", modelId, e.getMessage());
                    return Mono.empty();
                })));
    }

    public List<ModelInfo> listModels() {
        return registry.listModels();
    }

    public ModelInfo getModel(String modelId) {
        return registry.describe(modelId);
    }

    public Mono<String> saveModel(String modelId, String path) {
        return Mono.fromCallable(() -> registry.saveModel(modelId, path))
            .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<JsonNode> predict(String modelId, JsonNode input, PredictionOptions options) {
        return predictionService.predict(modelId, input, options);
    }

    public void registerPreprocessor(String modelId, DataProcessor preprocessor) {
        predictionService.registerPreprocessor(modelId, preprocessor);
    }

    public void registerPostprocessor(String modelId, DataProcessor postprocessor) {
        predictionService.registerPostprocessor(modelId, postprocessor);
    }

    public Mono<JsonNode> queueInference(String modelId, JsonNode input, PredictionOptions options) {
        return batchQueue.queueInference(modelId, input, options);
    }

    public Mono<Pipeline> createPipeline(String pipelineId, List<PipelineStep> steps) {
        return Mono.fromCallable(() -> pipelineEngine.createPipeline(pipelineId, steps));
    }

    public Mono<PipelineExecution> executePipeline(String pipelineId, JsonNode input, ExecutionOptions options) {
        return pipelineEngine.execute(pipelineId, input, options);
    }

    public Pipeline getPipeline(String pipelineId) {
        return pipelineEngine.getPipeline(pipelineId);
    }

    public boolean removePipeline(String pipelineId) {
        return pipelineEngine.removePipeline(pipelineId);
    }

    public Mono<TrainingJob> trainModel(String modelId, JsonNode trainingData, TrainingOptions options) {
        return trainingJobManager.trainModel(modelId, trainingData, options);
    }

    public void registerDataPreparer(String modelId, TrainingDataPreparer preparer) {
        trainingJobManager.registerDataPreparer(modelId, preparer);
    }

    public TrainingJob getTrainingJob(String jobId) {
        return trainingJobManager.getJob(jobId);
    }

    public List<TrainingJob> getActiveJobs() {
        return trainingJobManager.getActiveJobs();
    }

    /**
     * Point-in-time snapshot of hub-wide and per-model metrics
     */
    public HubMetrics getMetrics() {
        Map<String, ModelInfo> models = new LinkedHashMap<>();
        registry.listModels().forEach(info -> models.put(info.getModelId(), info));

        return HubMetrics.builder()
            .totalPredictions(registry.getTotalPredictions())
            .totalTrainingJobs(trainingJobManager.completedJobCount())
            .averageInferenceTime(registry.getAverageInferenceTimeMs())
            .models(models)
            .activeJobs(trainingJobManager.activeJobCount())
            .totalModels(models.size())
            .totalPipelines(pipelineEngine.size())
            .pendingInferences(batchQueue.pendingCount())
            .pipelines(pipelineEngine.metrics())
            .build();
    }

    public Flux<LifecycleEvent> events() {
        return eventPublisher.events();
    }
}
