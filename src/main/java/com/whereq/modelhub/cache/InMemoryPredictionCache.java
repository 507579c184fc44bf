package com.whereq.modelhub.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.whereq.modelhub.config.ModelHubProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import jakarta.annotation.PostConstruct;
import java.time.Duration;

/**
 * In-process prediction cache with per-entry expiry
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "modelhub.cache", name = "type", havingValue = "memory", matchIfMissing = true)
public class InMemoryPredictionCache implements PredictionCache {

    @Autowired
    private ModelHubProperties properties;

    private Cache<String, Entry> cache;

    public InMemoryPredictionCache() {
    }

    public InMemoryPredictionCache(long maxEntries) {
        this.cache = build(maxEntries);
    }

    @PostConstruct
    public void initialize() {
        if (cache == null) {
            cache = build(properties.getCache().getMaxEntries());
        }
        log.info("In-memory prediction cache initialized (max {} entries)", properties.getCache().getMaxEntries());
    }

    @Override
    public Mono<JsonNode> get(String modelId, String inputHash) {
        return Mono.fromSupplier(() -> {
            Entry entry = cache.getIfPresent(key(modelId, inputHash));
            return entry != null ? entry.output : null;
        });
    }

    @Override
    public Mono<Void> put(String modelId, String inputHash, JsonNode output, Duration ttl) {
        return Mono.fromRunnable(() -> cache.put(key(modelId, inputHash), new Entry(output, ttl)));
    }

    @Override
    public Mono<Void> evictModel(String modelId) {
        return Mono.fromRunnable(() -> cache.asMap().keySet().removeIf(key -> PredictionCache.isKeyOf(modelId, key)));
    }

    private static String key(String modelId, String inputHash) {
        return modelId + ":" + inputHash;
    }

    private static Cache<String, Entry> build(long maxEntries) {
        return Caffeine.newBuilder()
            .maximumSize(maxEntries)
            .expireAfter(new Expiry<String, Entry>() {
                @Override
                public long expireAfterCreate(String key, Entry value, long currentTime) {
                    return value.ttl.toNanos();
                }

                @Override
                public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
                    return value.ttl.toNanos();
                }

                @Override
                public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
                    return currentDuration;
                }
            })
            .build();
    }

    private static final class Entry {
        private final JsonNode output;
        private final Duration ttl;

        private Entry(JsonNode output, Duration ttl) {
            this.output = output;
            this.ttl = ttl;
        }
    }
}
