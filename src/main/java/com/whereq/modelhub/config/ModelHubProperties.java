package com.whereq.modelhub.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for WhereQ ModelHub.
 *
 * @author WhereQ Inc.
 */
@Configuration
@ConfigurationProperties(prefix = "modelhub")
@Data
public class ModelHubProperties {

    private TrainingConfig training = new TrainingConfig();

    private BatchConfig batch = new BatchConfig();

    private CacheConfig cache = new CacheConfig();

    private StorageConfig storage = new StorageConfig();

    @Data
    public static class TrainingConfig {
        /**
         * Maximum number of training jobs that may be active at once.
         */
        private int maxConcurrentJobs = 5;

        /**
         * Default number of epochs when a request does not specify one.
         */
        private int defaultEpochs = 10;

        /**
         * Default learning rate when a request does not specify one.
         */
        private double defaultLearningRate = 0.01;
    }

    @Data
    public static class BatchConfig {
        /**
         * Maximum number of queued requests taken in one drain pass.
         */
        private int maxBatchSize = 32;

        /**
         * Delay before the drain loop retries after an unexpected error.
         */
        private Duration retryBackoff = Duration.ofSeconds(1);

        /**
         * Delay before a drain pass starts, so requests submitted together share a batch.
         */
        private Duration linger = Duration.ofMillis(5);
    }

    @Data
    public static class CacheConfig {
        /**
         * Prediction cache backend.
         * MEMORY: in-process Caffeine cache (default)
         * REDIS: shared reactive Redis cache
         */
        private CacheType type = CacheType.MEMORY;

        /**
         * Lifetime of a cached prediction when the caller gives none.
         */
        private Duration defaultTtl = Duration.ofMinutes(5);

        /**
         * Upper bound on entries held by the in-memory cache.
         */
        private long maxEntries = 10_000;
    }

    @Data
    public static class StorageConfig {
        /**
         * Root directory of the file-system artifact store.
         */
        private String path = "./ml-models";
    }

    public enum CacheType {
        MEMORY,
        REDIS
    }
}
