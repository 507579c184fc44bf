package com.whereq.modelhub.prediction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.whereq.modelhub.cache.InputHasher;
import com.whereq.modelhub.cache.PredictionCache;
import com.whereq.modelhub.config.ModelHubProperties;
import com.whereq.modelhub.event.EventType;
import com.whereq.modelhub.event.LifecycleEventPublisher;
import com.whereq.modelhub.exception.NotFoundException;
import com.whereq.modelhub.exception.NotReadyException;
import com.whereq.modelhub.exception.PredictionException;
import com.whereq.modelhub.model.PredictionOptions;
import com.whereq.modelhub.registry.ModelRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single and batched inference around a registered model: preprocessing, the kind's
 * inference call, postprocessing, usage accounting and optional caching
 */
@Slf4j
@Service
public class PredictionService {

    @Autowired
    private ModelRegistry registry;

    @Autowired
    private PredictionCache cache;

    @Autowired
    private LifecycleEventPublisher eventPublisher;

    @Autowired
    private ModelHubProperties properties;

    @Autowired
    private MeterRegistry meterRegistry;

    private final Map<String, DataProcessor> preprocessors = new ConcurrentHashMap<>();
    private final Map<String, DataProcessor> postprocessors = new ConcurrentHashMap<>();

    private Counter cacheHitCounter;
    private Counter cacheMissCounter;

    @PostConstruct
    public void initialize() {
        cacheHitCounter = Counter.builder("modelhub.prediction.cache")
            .tag("result", "hit")
            .description("Prediction cache lookups")
            .register(meterRegistry);

        cacheMissCounter = Counter.builder("modelhub.prediction.cache")
            .tag("result", "miss")
            .description("Prediction cache lookups")
            .register(meterRegistry);
    }

    public void registerPreprocessor(String modelId, DataProcessor preprocessor) {
        preprocessors.put(modelId, preprocessor);
        log.info("Preprocessor registered for model {}", modelId);
    }

    public void registerPostprocessor(String modelId, DataProcessor postprocessor) {
        postprocessors.put(modelId, postprocessor);
        log.info("Postprocessor registered for model {}", modelId);
    }

    /**
     * Run one prediction
     *
     * @param modelId model id
     * @param input model input
     * @param options prediction options, may be null
     * @return Mono with the (postprocessed) output
     */
    public Mono<JsonNode> predict(String modelId, JsonNode input, PredictionOptions options) {
        PredictionOptions opts = options != null ? options : PredictionOptions.defaults();

        if (!opts.isCache()) {
            return infer(modelId, input);
        }

        // Readiness is checked before the cache so an unloaded model never serves stale results
        return Mono.fromCallable(() -> {
                registry.get(modelId);
                try {
                    return InputHasher.hash(input);
                } catch (IllegalArgumentException e) {
                    throw new PredictionException(modelId, e);
                }
            })
            .flatMap(inputHash -> lookupCache(modelId, inputHash)
                .doOnNext(hit -> {
                    cacheHitCounter.increment();
                    log.debug("Prediction cache hit for model {}", modelId);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    cacheMissCounter.increment();
                    return infer(modelId, input)
                        .flatMap(output -> storeCache(modelId, inputHash, output, opts).thenReturn(output));
                })));
    }

    /**
     * Run one inference call for a group of inputs of the same model
     *
     * @param modelId model id
     * @param inputs inputs in submission order
     * @return Mono with outputs in the same order
     */
    public Mono<List<JsonNode>> predictBatch(String modelId, List<JsonNode> inputs) {
        return Mono.fromCallable(() -> predictBatchBlocking(modelId, inputs))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<JsonNode> infer(String modelId, JsonNode input) {
        return Mono.fromCallable(() -> predictBlocking(modelId, input))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnError(error -> {
                log.error("Prediction failed for model {}: {}", modelId, error.getMessage());
                eventPublisher.publish(EventType.PREDICTION_ERROR, modelId,
                    Map.of("error", String.valueOf(error.getMessage())));
            });
    }

    private JsonNode predictBlocking(String modelId, JsonNode input) {
        long start = System.nanoTime();
        JsonNode result;
        try {
            result = registry.useModel(modelId, (capability, handle) -> {
                JsonNode preprocessed = applyProcessor(preprocessors.get(modelId), input);
                JsonNode raw = capability.infer(handle, preprocessed);
                return applyProcessor(postprocessors.get(modelId), raw);
            });
        } catch (NotFoundException | NotReadyException e) {
            throw e;
        } catch (Exception e) {
            throw new PredictionException(modelId, e);
        }

        // Usage is only recorded once the call succeeded
        double inferenceTimeMs = elapsedMs(start);
        registry.recordUsage(modelId, inferenceTimeMs);

        eventPublisher.publish(EventType.PREDICTION_COMPLETE, modelId, Map.of("inferenceTime", inferenceTimeMs));
        return result != null ? result : NullNode.getInstance();
    }

    private List<JsonNode> predictBatchBlocking(String modelId, List<JsonNode> inputs) {
        long start = System.nanoTime();
        List<JsonNode> outputs;
        try {
            outputs = registry.useModel(modelId, (capability, handle) -> {
                DataProcessor pre = preprocessors.get(modelId);
                DataProcessor post = postprocessors.get(modelId);

                List<JsonNode> prepared = new ArrayList<>(inputs.size());
                for (JsonNode input : inputs) {
                    prepared.add(applyProcessor(pre, input));
                }

                List<JsonNode> raw = capability.inferBatch(handle, prepared);
                if (raw == null || raw.size() != inputs.size()) {
                    throw new IllegalStateException("Batch inference returned "
                        + (raw == null ? "no" : raw.size()) + " outputs for " + inputs.size() + " inputs");
                }

                List<JsonNode> results = new ArrayList<>(raw.size());
                for (JsonNode output : raw) {
                    JsonNode result = applyProcessor(post, output);
                    results.add(result != null ? result : NullNode.getInstance());
                }
                return results;
            });
        } catch (NotFoundException | NotReadyException e) {
            throw e;
        } catch (Exception e) {
            throw new PredictionException(modelId, e);
        }

        registry.recordUsage(modelId, inputs.size(), elapsedMs(start));
        return outputs;
    }

    private Mono<JsonNode> lookupCache(String modelId, String inputHash) {
        return cache.get(modelId, inputHash)
            .onErrorResume(e -> {
                log.warn("Prediction cache lookup failed for model {}: {}", modelId, e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Void> storeCache(String modelId, String inputHash, JsonNode output, PredictionOptions options) {
        Duration ttl = options.getCacheTtl() != null
            ? options.getCacheTtl()
            : properties.getCache().getDefaultTtl();

        return cache.put(modelId, inputHash, output, ttl)
            .onErrorResume(e -> {
                log.warn("Failed to cache prediction for model {}: {}", modelId, e.getMessage());
                return Mono.empty();
            });
    }

    private static JsonNode applyProcessor(DataProcessor processor, JsonNode data) throws Exception {
        return processor != null ? processor.process(data) : data;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
