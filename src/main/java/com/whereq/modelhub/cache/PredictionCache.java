package com.whereq.modelhub.cache;

import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Cache of prediction outputs keyed by model id and input hash
 */
public interface PredictionCache {

    /**
     * Look up a cached output
     *
     * @param modelId model id
     * @param inputHash hash of the prediction input
     * @return Mono with the output, empty on miss or expiry
     */
    Mono<JsonNode> get(String modelId, String inputHash);

    /**
     * Store an output
     *
     * @param ttl lifetime of the entry
     * @return Mono that completes when stored
     */
    Mono<Void> put(String modelId, String inputHash, JsonNode output, Duration ttl);

    /**
     * Drop every entry of a model
     */
    Mono<Void> evictModel(String modelId);

    /**
     * Whether {@code modelId + ":" + inputHash} belongs to the model. Hashes never contain
     * the separator, so the last one ends the model id even when the id contains it.
     */
    static boolean isKeyOf(String modelId, String key) {
        return key.lastIndexOf(':') == modelId.length() && key.startsWith(modelId);
    }
}
