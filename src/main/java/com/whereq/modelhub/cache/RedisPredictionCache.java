package com.whereq.modelhub.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Prediction cache shared through Redis
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "modelhub.cache", name = "type", havingValue = "redis")
public class RedisPredictionCache implements PredictionCache {

    private static final String KEY_PREFIX = "modelhub:prediction:";

    @Autowired
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Override
    public Mono<JsonNode> get(String modelId, String inputHash) {
        return redisTemplate.opsForValue()
            .get(key(modelId, inputHash))
            .flatMap(json -> {
                try {
                    return Mono.just(objectMapper.readTree(json));
                } catch (JsonProcessingException e) {
                    log.error("Failed to deserialize cached prediction for model {}", modelId, e);
                    return Mono.empty();
                }
            });
    }

    @Override
    public Mono<Void> put(String modelId, String inputHash, JsonNode output, Duration ttl) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(output))
            .flatMap(json -> redisTemplate.opsForValue().set(key(modelId, inputHash), json, ttl))
            .doOnSuccess(stored -> log.debug("Cached prediction for model {} (ttl {})", modelId, ttl))
            .then();
    }

    @Override
    public Mono<Void> evictModel(String modelId) {
        ScanOptions options = ScanOptions.scanOptions().match(KEY_PREFIX + escapeGlob(modelId) + ":*").build();
        return redisTemplate.scan(options)
            .filter(key -> PredictionCache.isKeyOf(modelId, key.substring(KEY_PREFIX.length())))
            .collectList()
            .flatMap(keys -> keys.isEmpty()
                ? Mono.just(0L)
                : redisTemplate.delete(keys.toArray(new String[0])))
            .doOnSuccess(deleted -> log.info("Evicted {} cached predictions for model {}", deleted, modelId))
            .then();
    }

    /**
     * Escape the characters SCAN MATCH treats as a pattern
     */
    static String escapeGlob(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                escaped.append('\\');
            }
            escaped.append(c);
        }
        return escaped.toString();
    }

    private static String key(String modelId, String inputHash) {
        return KEY_PREFIX + modelId + ":" + inputHash;
    }
}
