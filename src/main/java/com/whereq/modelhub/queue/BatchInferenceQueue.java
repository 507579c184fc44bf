package com.whereq.modelhub.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.config.ModelHubProperties;
import com.whereq.modelhub.event.EventType;
import com.whereq.modelhub.event.LifecycleEventPublisher;
import com.whereq.modelhub.model.PredictionOptions;
import com.whereq.modelhub.prediction.PredictionService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
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
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Buffers single inference requests and dispatches them grouped by model, one batch
 * inference call per model group.
 *
 * <p>Callers append under a mutex; a single drain loop, guarded by the running flag,
 * takes up to {@code maxBatchSize} requests from the front of the pending list per pass.
 */
@Slf4j
@Service
public class BatchInferenceQueue {

    @Autowired
    private PredictionService predictionService;

    @Autowired
    private LifecycleEventPublisher eventPublisher;

    @Autowired
    private ModelHubProperties properties;

    @Autowired
    private MeterRegistry meterRegistry;

    private final Object lock = new Object();

    private final List<QueuedInferenceRequest> pending = new ArrayList<>();

    private final AtomicBoolean running = new AtomicBoolean(false);

    @PostConstruct
    public void initialize() {
        if (properties.getBatch().getMaxBatchSize() <= 0) {
            throw new IllegalStateException("modelhub.batch.max-batch-size must be positive: "
                + properties.getBatch().getMaxBatchSize());
        }

        Gauge.builder("modelhub.batch.pending", this::pendingCount)
            .description("Number of queued inference requests")
            .register(meterRegistry);

        log.info("BatchInferenceQueue initialized: max batch size={}, linger={}",
            properties.getBatch().getMaxBatchSize(), properties.getBatch().getLinger());
    }

    /**
     * Queue one inference request
     *
     * @param modelId model id
     * @param input model input
     * @param options prediction options, may be null; requests asking for the cache are
     *                served individually through the cache-aware path
     * @return Mono with this request's output, resolved when its batch has run
     */
    public Mono<JsonNode> queueInference(String modelId, JsonNode input, PredictionOptions options) {
        PredictionOptions opts = options != null ? options : PredictionOptions.defaults();

        return Mono.create(sink -> {
            QueuedInferenceRequest request = new QueuedInferenceRequest(modelId, input, opts, sink, Instant.now());
            synchronized (lock) {
                pending.add(request);
            }
            log.debug("Queued inference request for model {}", modelId);
            startDrain();
        });
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    private void startDrain() {
        if (running.compareAndSet(false, true)) {
            scheduleDrain(properties.getBatch().getLinger());
        }
    }

    private void scheduleDrain(Duration delay) {
        Mono.delay(delay, Schedulers.boundedElastic())
            .subscribe(tick -> drainPass());
    }

    private void drainPass() {
        List<QueuedInferenceRequest> batch;
        synchronized (lock) {
            int size = Math.min(properties.getBatch().getMaxBatchSize(), pending.size());
            batch = new ArrayList<>(pending.subList(0, size));
        }

        if (batch.isEmpty()) {
            goIdle();
            return;
        }

        try {
            Map<String, List<QueuedInferenceRequest>> groups = new LinkedHashMap<>();
            for (QueuedInferenceRequest request : batch) {
                groups.computeIfAbsent(request.getModelId(), id -> new ArrayList<>()).add(request);
            }

            log.debug("Drain pass: {} requests across {} models", batch.size(), groups.size());

            List<Mono<Void>> dispatches = new ArrayList<>(groups.size());
            groups.forEach((modelId, group) -> dispatches.add(dispatchGroup(modelId, group)));

            Mono.when(dispatches)
                .subscribe(
                    ignored -> { },
                    error -> retryAfterBackoff(error),
                    () -> finishPass(batch));
        } catch (Exception e) {
            retryAfterBackoff(e);
        }
    }

    private Mono<Void> dispatchGroup(String modelId, List<QueuedInferenceRequest> group) {
        List<QueuedInferenceRequest> batched = new ArrayList<>(group.size());
        List<Mono<Void>> individual = new ArrayList<>();

        for (QueuedInferenceRequest request : group) {
            if (request.getOptions().isCache()) {
                individual.add(predictionService.predict(modelId, request.getInput(), request.getOptions())
                    .doOnNext(output -> request.getSink().success(output))
                    .doOnError(error -> request.getSink().error(error))
                    .onErrorResume(error -> Mono.empty())
                    .then());
            } else {
                batched.add(request);
            }
        }

        if (!batched.isEmpty()) {
            individual.add(dispatchBatch(modelId, batched));
        }
        return Mono.when(individual);
    }

    private Mono<Void> dispatchBatch(String modelId, List<QueuedInferenceRequest> group) {
        List<JsonNode> inputs = new ArrayList<>(group.size());
        group.forEach(request -> inputs.add(request.getInput()));

        return predictionService.predictBatch(modelId, inputs)
            .doOnNext(outputs -> {
                for (int i = 0; i < group.size(); i++) {
                    group.get(i).getSink().success(outputs.get(i));
                }
                eventPublisher.publish(EventType.BATCH_COMPLETED, modelId, Map.of("batchSize", group.size()));
            })
            .doOnError(error -> {
                log.warn("Batch of {} requests for model {} failed: {}", group.size(), modelId, error.getMessage());
                group.forEach(request -> request.getSink().error(error));
                eventPublisher.publish(EventType.BATCH_FAILED, modelId,
                    Map.of("batchSize", group.size(), "error", String.valueOf(error.getMessage())));
            })
            .onErrorResume(error -> Mono.empty())
            .then();
    }

    private void finishPass(List<QueuedInferenceRequest> batch) {
        boolean more;
        synchronized (lock) {
            pending.removeAll(batch);
            more = !pending.isEmpty();
        }

        if (more) {
            scheduleDrain(Duration.ZERO);
        } else {
            goIdle();
        }
    }

    private void goIdle() {
        running.set(false);
        // A request may have arrived between the empty check and the flag reset
        if (pendingCount() > 0) {
            startDrain();
        }
    }

    private void retryAfterBackoff(Throwable error) {
        Duration backoff = properties.getBatch().getRetryBackoff();
        log.error("Drain loop error, retrying in {}: {}", backoff, error.getMessage(), error);
        scheduleDrain(backoff);
    }
}
