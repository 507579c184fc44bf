package com.whereq.modelhub.training;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.capability.ProgressSink;
import com.whereq.modelhub.config.ModelHubProperties;
import com.whereq.modelhub.event.EventType;
import com.whereq.modelhub.event.LifecycleEventPublisher;
import com.whereq.modelhub.exception.CapacityException;
import com.whereq.modelhub.exception.NotFoundException;
import com.whereq.modelhub.exception.TrainingException;
import com.whereq.modelhub.model.Notifications;
import com.whereq.modelhub.model.TrainingJob;
import com.whereq.modelhub.model.TrainingJobStatus;
import com.whereq.modelhub.model.TrainingOptions;
import com.whereq.modelhub.model.TrainingResult;
import com.whereq.modelhub.registry.ModelRegistry;
import com.whereq.modelhub.service.WebhookNotifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs training jobs against registered models under a global concurrency cap.
 * A slot is reserved before a job exists and released on every exit path, so the
 * number of active jobs never exceeds the cap.
 */
@Slf4j
@Service
public class TrainingJobManager {

    @Autowired
    private ModelRegistry registry;

    @Autowired
    private LifecycleEventPublisher eventPublisher;

    @Autowired
    private WebhookNotifier webhookNotifier;

    @Autowired
    private ModelHubProperties properties;

    @Autowired
    private MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, TrainingJob> activeJobs = new ConcurrentHashMap<>();

    private final Map<String, TrainingDataPreparer> preparers = new ConcurrentHashMap<>();

    private final AtomicLong jobSequence = new AtomicLong();

    private final AtomicLong completedJobs = new AtomicLong();

    private Semaphore slots;

    private int maxConcurrentJobs;

    private Counter successCounter;
    private Counter failureCounter;
    private Counter rejectedCounter;
    private Timer trainingTimer;

    @PostConstruct
    public void initialize() {
        maxConcurrentJobs = properties.getTraining().getMaxConcurrentJobs();
        if (maxConcurrentJobs <= 0) {
            throw new IllegalStateException("modelhub.training.max-concurrent-jobs must be positive: "
                + maxConcurrentJobs);
        }
        slots = new Semaphore(maxConcurrentJobs);

        successCounter = Counter.builder("modelhub.training.completed")
            .description("Number of successfully completed training jobs")
            .register(meterRegistry);

        failureCounter = Counter.builder("modelhub.training.failed")
            .description("Number of failed training jobs")
            .register(meterRegistry);

        rejectedCounter = Counter.builder("modelhub.training.rejected")
            .description("Number of training requests rejected at the concurrency cap")
            .register(meterRegistry);

        trainingTimer = Timer.builder("modelhub.training.time")
            .description("Training job duration")
            .register(meterRegistry);

        Gauge.builder("modelhub.training.active", activeJobs::size)
            .description("Number of active training jobs")
            .register(meterRegistry);

        log.info("TrainingJobManager initialized: max concurrent jobs={}", maxConcurrentJobs);
    }

    /**
     * Train a model
     *
     * @param modelId model id
     * @param trainingData raw training data
     * @param options training options, may be null
     * @return Mono with the terminal job snapshot; errors with {@link NotFoundException},
     *         {@link com.whereq.modelhub.exception.NotReadyException}, {@link CapacityException}
     *         before the job starts, or {@link TrainingException} once it has started
     */
    public Mono<TrainingJob> trainModel(String modelId, JsonNode trainingData, TrainingOptions options) {
        TrainingOptions opts = options != null ? options : TrainingOptions.defaults();
        return Mono.fromCallable(() -> runTraining(modelId, trainingData, opts))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Override how training data is prepared for one model
     */
    public void registerDataPreparer(String modelId, TrainingDataPreparer preparer) {
        preparers.put(modelId, preparer);
        log.info("Training data preparer registered for model {}", modelId);
    }

    /**
     * Get an active job
     *
     * @param jobId job id
     * @return job snapshot
     * @throws NotFoundException if unknown or already finished
     */
    public TrainingJob getJob(String jobId) {
        TrainingJob job = activeJobs.get(jobId);
        if (job == null) {
            throw NotFoundException.job(jobId);
        }
        return job.snapshot();
    }

    public List<TrainingJob> getActiveJobs() {
        List<TrainingJob> jobs = new ArrayList<>(activeJobs.size());
        activeJobs.values().forEach(job -> jobs.add(job.snapshot()));
        return jobs;
    }

    public int activeJobCount() {
        return activeJobs.size();
    }

    public long completedJobCount() {
        return completedJobs.get();
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    private TrainingJob runTraining(String modelId, JsonNode trainingData, TrainingOptions options) {
        // Identity and readiness first: a model mid-load fails instead of racing the load
        registry.get(modelId);

        if (!slots.tryAcquire()) {
            rejectedCounter.increment();
            log.warn("Training for model {} rejected: {} jobs active (max {})",
                modelId, activeJobs.size(), maxConcurrentJobs);
            throw new CapacityException("Maximum concurrent training jobs reached (" + maxConcurrentJobs + ")");
        }

        String jobId = "train_" + modelId + "_" + System.currentTimeMillis() + "_" + jobSequence.incrementAndGet();
        TrainingJob job = TrainingJob.builder()
            .jobId(jobId)
            .modelId(modelId)
            .status(TrainingJobStatus.PREPARING)
            .progress(0)
            .metrics(Map.of())
            .startTime(Instant.now())
            .build();

        try {
            activeJobs.put(jobId, job);
            eventPublisher.publish(EventType.TRAINING_STARTED, jobId, jobAttributes(job));
            log.info("Training job {} started for model {}", jobId, modelId);

            try {
                TrainingResult result = execute(job, trainingData, options);
                complete(job, result, options);
                return job.snapshot();
            } catch (Exception e) {
                fail(job, e, options);
                throw new TrainingException(modelId, jobId, e);
            }
        } finally {
            activeJobs.remove(jobId);
            slots.release();
            trainingTimer.record(Duration.between(job.getStartTime(), Instant.now()));
        }
    }

    private TrainingResult execute(TrainingJob job, JsonNode trainingData, TrainingOptions options) throws Exception {
        String modelId = job.getModelId();
        TrainingDataPreparer preparer = preparers.get(modelId);

        ProgressSink progress = (percentComplete, metrics) -> {
            job.setProgress(Math.max(0.0, Math.min(100.0, percentComplete)));
            job.setMetrics(metrics != null ? Map.copyOf(metrics) : Map.of());
            eventPublisher.publish(EventType.TRAINING_PROGRESS, job.getJobId(), jobAttributes(job));
        };

        TrainingResult result = registry.useModel(modelId, (capability, handle) -> {
            job.setStatus(TrainingJobStatus.PREPROCESSING);
            Object payload = preparer != null
                ? preparer.prepare(trainingData, options)
                : capability.prepareTrainingData(handle, trainingData, options);

            job.setStatus(TrainingJobStatus.TRAINING);
            return capability.train(handle, payload, options, progress);
        });

        TrainingResult finalResult = result != null ? result : new TrainingResult();

        // Save before the job reports success, a failed save fails the job
        if (options.isSave()) {
            registry.saveModel(modelId, options.getSavePath());
        }
        return finalResult;
    }

    private void complete(TrainingJob job, TrainingResult result, TrainingOptions options) {
        job.setResult(result);
        if (result.getMetrics() != null) {
            job.setMetrics(Map.copyOf(result.getMetrics()));
        }
        job.setProgress(100.0);
        job.setEndTime(Instant.now());
        job.setStatus(TrainingJobStatus.COMPLETED);

        registry.recordTrainingResult(job.getModelId(), result.getAccuracy(), result.getError());
        completedJobs.incrementAndGet();
        successCounter.increment();

        eventPublisher.publish(EventType.TRAINING_COMPLETED, job.getJobId(), jobAttributes(job));
        log.info("Training completed for model {} (job {}): accuracy={}, error={}",
            job.getModelId(), job.getJobId(), result.getAccuracy(), result.getError());

        notifyWebhook(job, options);
    }

    private void fail(TrainingJob job, Exception error, TrainingOptions options) {
        job.setErrorMessage(error.getMessage());
        job.setEndTime(Instant.now());
        job.setStatus(TrainingJobStatus.FAILED);
        failureCounter.increment();

        log.error("Training failed for model {} (job {}): {}", job.getModelId(), job.getJobId(),
            error.getMessage(), error);

        Map<String, Object> attributes = jobAttributes(job);
        attributes.put("error", String.valueOf(error.getMessage()));
        eventPublisher.publish(EventType.TRAINING_FAILED, job.getJobId(), attributes);

        notifyWebhook(job, options);
    }

    private void notifyWebhook(TrainingJob job, TrainingOptions options) {
        Notifications notifications = options.getNotifications();
        if (notifications != null && notifications.shouldNotify(job.getStatus())) {
            webhookNotifier.notify(notifications.getWebhook(), job.snapshot()).subscribe();
        }
    }

    private static Map<String, Object> jobAttributes(TrainingJob job) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("modelId", job.getModelId());
        attributes.put("status", job.getStatus().name());
        attributes.put("progress", job.getProgress());
        attributes.put("metrics", job.getMetrics());
        return attributes;
    }
}
