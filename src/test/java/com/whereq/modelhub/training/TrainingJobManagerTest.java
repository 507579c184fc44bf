package com.whereq.modelhub.training;

import com.whereq.modelhub.TestModels;
import com.whereq.modelhub.TestModels.BlockingTrainer;
import com.whereq.modelhub.event.EventType;
import com.whereq.modelhub.event.LifecycleEvent;
import com.whereq.modelhub.exception.CapacityException;
import com.whereq.modelhub.exception.NotFoundException;
import com.whereq.modelhub.exception.TrainingException;
import com.whereq.modelhub.model.ModelConfig;
import com.whereq.modelhub.model.ModelKind;
import com.whereq.modelhub.model.TrainingJob;
import com.whereq.modelhub.model.TrainingJobStatus;
import com.whereq.modelhub.model.TrainingOptions;
import com.whereq.modelhub.registry.ModelRegistry;
import com.whereq.modelhub.service.ModelHub;
import com.whereq.modelhub.storage.ArtifactStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static com.whereq.modelhub.TestModels.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("TrainingJobManager Integration Tests")
class TrainingJobManagerTest {

    @Autowired
    private ModelHub hub;

    @Autowired
    private TrainingJobManager jobManager;

    @Autowired
    private ModelRegistry registry;

    @Autowired
    private ArtifactStore artifactStore;

    private final List<String> registered = new ArrayList<>();

    @AfterEach
    void tearDown() {
        registered.forEach(modelId -> {
            if (registry.contains(modelId)) {
                hub.unregisterModel(modelId).block();
            }
        });
    }

    private String register(String prefix, ModelConfig config) {
        String modelId = TestModels.uniqueId(prefix);
        hub.registerModel(modelId, config).block();
        registered.add(modelId);
        return modelId;
    }

    @Test
    @DisplayName("Training an unknown model fails with NotFound and starts no job")
    void shouldFailForUnknownModel() {
        StepVerifier.create(hub.trainModel(TestModels.uniqueId("ghost"), json("[]"), null))
            .expectError(NotFoundException.class)
            .verify();

        assertThat(jobManager.activeJobCount()).isZero();
    }

    @Test
    @DisplayName("Only max-concurrent-jobs jobs run; the extra request is rejected")
    void shouldEnforceConcurrencyCap() throws Exception {
        assertThat(jobManager.getMaxConcurrentJobs()).isEqualTo(2);
        CountDownLatch started = new CountDownLatch(2);
        BlockingTrainer trainer = new BlockingTrainer(started);
        String modelId = register("capped", TestModels.custom(trainer));
        long completedBefore = jobManager.completedJobCount();

        List<CompletableFuture<TrainingJob>> jobs = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            jobs.add(hub.trainModel(modelId, json("[]"), null).toFuture());
        }

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        waitUntil(() -> jobs.stream().filter(CompletableFuture::isDone).count() == 1);

        List<Throwable> rejections = new ArrayList<>();
        for (CompletableFuture<TrainingJob> job : jobs) {
            if (job.isDone()) {
                rejections.add(causeOf(job));
            }
        }
        assertThat(rejections).hasSize(1);
        assertThat(rejections.get(0)).isInstanceOf(CapacityException.class);

        assertThat(jobManager.activeJobCount()).isEqualTo(2);
        List<TrainingJob> active = hub.getActiveJobs();
        assertThat(active).extracting(TrainingJob::getModelId).containsOnly(modelId);
        assertThat(active).extracting(TrainingJob::getStatus).containsOnly(TrainingJobStatus.TRAINING);
        assertThat(hub.getTrainingJob(active.get(0).getJobId()).getJobId()).startsWith("train_" + modelId + "_");
        assertThat(hub.getMetrics().getActiveJobs()).isEqualTo(2);

        trainer.release.countDown();

        for (CompletableFuture<TrainingJob> job : jobs) {
            if (!job.isCompletedExceptionally()) {
                TrainingJob done = job.get(5, TimeUnit.SECONDS);
                assertThat(done.getStatus()).isEqualTo(TrainingJobStatus.COMPLETED);
                assertThat(done.getProgress()).isEqualTo(100.0);
                assertThat(done.getEndTime()).isNotNull();
            }
        }
        assertThat(jobManager.activeJobCount()).isZero();
        assertThat(jobManager.completedJobCount() - completedBefore).isEqualTo(2);
        assertThat(registry.get(modelId).getMetrics().getAccuracy()).isEqualTo(0.9);
        assertThatThrownBy(() -> hub.getTrainingJob(active.get(0).getJobId()))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Progress and terminal events are emitted for a job")
    void shouldEmitProgressEvents() throws Exception {
        BlockingTrainer trainer = new BlockingTrainer(new CountDownLatch(1));
        trainer.release.countDown();
        String modelId = register("progress", TestModels.custom(trainer));

        CompletableFuture<List<LifecycleEvent>> received = hub.events()
            .filter(event -> modelId.equals(event.getAttributes().get("modelId")))
            .take(4)
            .collectList()
            .toFuture();

        TrainingJob job = hub.trainModel(modelId, json("[]"), null).block();
        List<LifecycleEvent> events = received.get(5, TimeUnit.SECONDS);

        assertThat(job.getStatus()).isEqualTo(TrainingJobStatus.COMPLETED);
        assertThat(job.getResult().getAccuracy()).isEqualTo(0.9);
        assertThat(events).extracting(LifecycleEvent::getType).containsExactly(
            EventType.TRAINING_STARTED,
            EventType.TRAINING_PROGRESS,
            EventType.TRAINING_PROGRESS,
            EventType.TRAINING_COMPLETED);
        assertThat(events.get(1).getAttributes().get("progress")).isEqualTo(50.0);
        assertThat(events).extracting(LifecycleEvent::getSubjectId).containsOnly(job.getJobId());
    }

    @Test
    @DisplayName("A failed job is recorded, removed and frees its slot")
    void shouldReleaseSlotOnFailure() {
        BlockingTrainer trainer = new BlockingTrainer(new CountDownLatch(1), true);
        trainer.release.countDown();
        String modelId = register("failing", TestModels.custom(trainer));

        for (int i = 0; i < 3; i++) {
            StepVerifier.create(hub.trainModel(modelId, json("[]"), null))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(TrainingException.class);
                    assertThat(((TrainingException) error).getJobId()).startsWith("train_" + modelId);
                    assertThat(error.getCause()).hasMessage("training exploded");
                })
                .verify();
        }

        assertThat(jobManager.activeJobCount()).isZero();
        assertThat(registry.get(modelId).getMetrics().getAccuracy()).isNull();
    }

    @Test
    @DisplayName("Models without training support fail the job")
    void shouldFailWhenTrainingUnsupported() {
        String modelId = register("untrainable", TestModels.custom(input -> input));

        StepVerifier.create(hub.trainModel(modelId, json("[]"), null))
            .expectErrorSatisfies(error -> assertThat(error.getCause())
                .isInstanceOf(UnsupportedOperationException.class))
            .verify();

        assertThat(jobManager.activeJobCount()).isZero();
    }

    @Test
    @DisplayName("Linear models train, record their error and save when asked")
    void shouldTrainAndSaveLinearModel() {
        String modelId = register("linear", ModelConfig.builder()
            .kind(ModelKind.LINEAR)
            .params(json("{\"inputSize\": 1}"))
            .build());
        TrainingOptions options = TrainingOptions.builder()
            .epochs(5)
            .learningRate(0.05)
            .save(true)
            .build();

        TrainingJob job = hub.trainModel(modelId,
            json("[{\"features\": [1], \"label\": 2}, {\"features\": [2], \"label\": 4}]"), options).block();

        assertThat(job.getStatus()).isEqualTo(TrainingJobStatus.COMPLETED);
        assertThat(job.getResult().getIterations()).isEqualTo(5);
        assertThat(job.getMetrics()).containsKey("loss");
        assertThat(registry.get(modelId).getMetrics().getError())
            .isCloseTo(job.getResult().getError(), within(1e-12));
        assertThat(artifactStore.exists(modelId + "/model.json")).isTrue();
    }

    @Test
    @DisplayName("A registered data preparer replaces the kind's preparation")
    void shouldUseRegisteredPreparer() {
        String modelId = register("prepared", ModelConfig.builder()
            .kind(ModelKind.LINEAR)
            .params(json("{\"inputSize\": 1}"))
            .build());
        hub.registerDataPreparer(modelId, (data, options) -> {
            throw new IllegalArgumentException("preparer says no");
        });

        StepVerifier.create(hub.trainModel(modelId, json("[]"), null))
            .expectErrorSatisfies(error -> assertThat(error.getCause()).hasMessage("preparer says no"))
            .verify();
    }

    private static Throwable causeOf(CompletableFuture<TrainingJob> job) {
        try {
            job.get();
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(condition.getAsBoolean()).isTrue();
    }
}
