package com.whereq.modelhub.registry;

import com.whereq.modelhub.capability.ModelCapabilities;
import com.whereq.modelhub.capability.ModelCapability;
import com.whereq.modelhub.dto.ModelInfo;
import com.whereq.modelhub.event.EventType;
import com.whereq.modelhub.event.LifecycleEventPublisher;
import com.whereq.modelhub.exception.DuplicateModelException;
import com.whereq.modelhub.exception.ModelLoadException;
import com.whereq.modelhub.exception.NotFoundException;
import com.whereq.modelhub.exception.NotReadyException;
import com.whereq.modelhub.model.ModelConfig;
import com.whereq.modelhub.model.ModelStatus;
import com.whereq.modelhub.storage.ArtifactStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * Owns loaded models, their status and their usage metrics. The only place model
 * handles are created, used and disposed.
 */
@Slf4j
@Component
public class ModelRegistry {

    @Autowired
    private ModelCapabilities capabilities;

    @Autowired
    private ArtifactStore artifactStore;

    @Autowired
    private LifecycleEventPublisher eventPublisher;

    @Autowired
    private MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, RegisteredModel> models = new ConcurrentHashMap<>();

    private final Object statsLock = new Object();
    private long totalPredictions;
    private double averageInferenceTimeMs;

    private Timer inferenceTimer;

    @PostConstruct
    public void initialize() {
        inferenceTimer = Timer.builder("modelhub.inference.time")
            .description("Model inference time")
            .register(meterRegistry);

        Gauge.builder("modelhub.models.loaded", this::readyCount)
            .description("Number of models in READY status")
            .register(meterRegistry);

        log.info("ModelRegistry initialized");
    }

    /**
     * Register and load a model
     *
     * @param modelId caller-assigned model id
     * @param config registration config
     * @return Mono with the READY model's view
     */
    public Mono<ModelInfo> register(String modelId, ModelConfig config) {
        return Mono.fromCallable(() -> registerBlocking(modelId, config))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private ModelInfo registerBlocking(String modelId, ModelConfig config) {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("Model id is required");
        }
        if (config == null || config.getKind() == null) {
            throw new IllegalArgumentException("Model kind is required for " + modelId);
        }

        RegisteredModel entry = models.compute(modelId, (id, existing) -> {
            // A FAILED entry may be replaced, a READY or LOADING one may not
            if (existing != null && existing.getStatus() != ModelStatus.FAILED) {
                throw new DuplicateModelException(id);
            }
            return new RegisteredModel(id, config);
        });

        log.info("Loading model {} ({}, version {})", modelId, config.getKind(), config.getVersion());

        ModelCapability capability = capabilities.forKind(config.getKind());
        Object handle;
        try {
            handle = capability.load(modelId, config);
            entry.markReady(handle);
        } catch (Exception e) {
            entry.markFailed(e.getMessage());
            log.error("Failed to register model {}: {}", modelId, e.getMessage(), e);
            eventPublisher.publish(EventType.MODEL_FAILED, modelId,
                Map.of("kind", config.getKind().name(), "error", String.valueOf(e.getMessage())));
            throw new ModelLoadException(modelId, e);
        }

        // Unregistered while loading: the fresh handle has no owner
        if (models.get(modelId) != entry) {
            log.warn("Model {} was unregistered while loading", modelId);
            disposeOrphan(capability, entry);
            throw NotFoundException.model(modelId);
        }

        eventPublisher.publish(EventType.MODEL_REGISTERED, modelId,
            Map.of("kind", config.getKind().name(), "version", String.valueOf(config.getVersion())));
        log.info("Model registered: {}", modelId);

        return entry.toInfo();
    }

    /**
     * Remove a model and dispose its handle once in-flight users release it
     *
     * @param modelId model id
     * @return Mono that completes when the handle is disposed
     */
    public Mono<Void> unregister(String modelId) {
        return Mono.fromCallable(() -> {
                unregisterBlocking(modelId);
                return modelId;
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    private void unregisterBlocking(String modelId) throws Exception {
        RegisteredModel entry = models.remove(modelId);
        if (entry == null) {
            throw NotFoundException.model(modelId);
        }

        Lock writeLock = entry.getUsageLock().writeLock();
        writeLock.lock();
        try {
            Object handle = entry.releaseHandle();
            if (handle != null) {
                capabilities.forKind(entry.getKind()).dispose(handle);
            }
        } finally {
            writeLock.unlock();
        }

        eventPublisher.publish(EventType.MODEL_UNREGISTERED, modelId, Map.of("kind", entry.getKind().name()));
        log.info("Model {} unregistered", modelId);
    }

    /**
     * Get a READY model
     *
     * @param modelId model id
     * @return model view
     * @throws NotFoundException if absent
     * @throws NotReadyException if not READY
     */
    public ModelInfo get(String modelId) {
        return resolveReady(modelId).toInfo();
    }

    /**
     * Get a model in any status
     */
    public ModelInfo describe(String modelId) {
        RegisteredModel entry = models.get(modelId);
        if (entry == null) {
            throw NotFoundException.model(modelId);
        }
        return entry.toInfo();
    }

    public boolean contains(String modelId) {
        return models.containsKey(modelId);
    }

    public List<ModelInfo> listModels() {
        List<ModelInfo> infos = new ArrayList<>(models.size());
        models.values().forEach(entry -> infos.add(entry.toInfo()));
        return infos;
    }

    public int size() {
        return models.size();
    }

    /**
     * Run an action against a READY model's handle. Blocking; the handle cannot be
     * disposed while the action runs.
     *
     * @param modelId model id
     * @param action work to run with the kind's capability and the handle
     * @return action result
     */
    public <T> T useModel(String modelId, ModelAction<T> action) throws Exception {
        RegisteredModel entry = resolveReady(modelId);

        Lock readLock = entry.getUsageLock().readLock();
        readLock.lock();
        try {
            // Re-check under the lock, unregister may have won the race
            Object handle = entry.getHandle();
            if (handle == null || models.get(modelId) != entry) {
                throw NotFoundException.model(modelId);
            }
            return action.apply(capabilities.forKind(entry.getKind()), handle);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Record usage of a model
     *
     * @param modelId model id
     * @param inferenceTimeMs elapsed inference time
     */
    public void recordUsage(String modelId, double inferenceTimeMs) {
        recordUsage(modelId, 1, inferenceTimeMs);
    }

    /**
     * Record usage of a model for a number of inferences served together
     */
    public void recordUsage(String modelId, int inferenceCount, double inferenceTimeMs) {
        RegisteredModel entry = models.get(modelId);
        if (entry == null) {
            log.debug("Usage for unknown model {} ignored", modelId);
            return;
        }

        entry.getMetrics().recordUsage(inferenceCount, inferenceTimeMs);
        inferenceTimer.record(Duration.ofNanos((long) (inferenceTimeMs * 1_000_000)));

        synchronized (statsLock) {
            long previous = totalPredictions;
            totalPredictions += inferenceCount;
            averageInferenceTimeMs = (averageInferenceTimeMs * previous + inferenceTimeMs) / totalPredictions;
        }
    }

    /**
     * Store final training metrics on a model
     */
    public void recordTrainingResult(String modelId, Double accuracy, Double error) {
        RegisteredModel entry = models.get(modelId);
        if (entry == null) {
            log.warn("Training result for unknown model {} dropped", modelId);
            return;
        }
        entry.getMetrics().recordTraining(accuracy, error);
    }

    /**
     * Persist a model through its kind's save capability
     *
     * @param modelId model id
     * @param path artifact path, defaults to {@code <modelId>/model.json}
     * @return path the model was saved to
     */
    public String saveModel(String modelId, String path) throws Exception {
        String target = path != null ? path : defaultArtifactPath(modelId);
        useModel(modelId, (capability, handle) -> {
            capability.save(handle, artifactStore, target);
            return target;
        });
        log.info("Model saved: {} to {}", modelId, target);
        return target;
    }

    public long getTotalPredictions() {
        synchronized (statsLock) {
            return totalPredictions;
        }
    }

    public double getAverageInferenceTimeMs() {
        synchronized (statsLock) {
            return averageInferenceTimeMs;
        }
    }

    public static String defaultArtifactPath(String modelId) {
        return modelId + "/model.json";
    }

    @PreDestroy
    public void shutdown() {
        log.info("Disposing {} models", models.size());
        for (String modelId : new ArrayList<>(models.keySet())) {
            try {
                unregisterBlocking(modelId);
            } catch (NotFoundException e) {
                log.debug("Model {} already removed", modelId);
            } catch (Exception e) {
                log.error("Failed to dispose model {} on shutdown", modelId, e);
            }
        }
    }

    private RegisteredModel resolveReady(String modelId) {
        RegisteredModel entry = models.get(modelId);
        if (entry == null) {
            throw NotFoundException.model(modelId);
        }
        if (entry.getStatus() != ModelStatus.READY) {
            throw new NotReadyException(modelId, entry.getStatus());
        }
        return entry;
    }

    private long readyCount() {
        return models.values().stream().filter(entry -> entry.getStatus() == ModelStatus.READY).count();
    }

    /**
     * Dispose the handle of an entry that was removed while loading, unless the removal
     * already released it
     */
    void disposeOrphan(ModelCapability capability, RegisteredModel entry) {
        Object handle;
        Lock writeLock = entry.getUsageLock().writeLock();
        writeLock.lock();
        try {
            handle = entry.releaseHandle();
        } finally {
            writeLock.unlock();
        }

        if (handle == null) {
            log.debug("Handle of model {} was already disposed by unregister", entry.getModelId());
            return;
        }
        disposeQuietly(capability, entry.getModelId(), handle);
    }

    private void disposeQuietly(ModelCapability capability, String modelId, Object handle) {
        try {
            capability.dispose(handle);
        } catch (Exception e) {
            log.error("Failed to dispose handle of model {}", modelId, e);
        }
    }
}
