package com.whereq.modelhub.service;

import com.whereq.modelhub.TestModels;
import com.whereq.modelhub.dto.HubMetrics;
import com.whereq.modelhub.event.EventType;
import com.whereq.modelhub.event.LifecycleEvent;
import com.whereq.modelhub.model.TrainingJob;
import com.whereq.modelhub.model.TrainingJobStatus;
import com.whereq.modelhub.pipeline.PipelineStep;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.whereq.modelhub.TestModels.json;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("ModelHub Integration Tests")
class ModelHubTest {

    @Autowired
    private ModelHub hub;

    @Autowired
    private WebhookNotifier webhookNotifier;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("Metrics reflect models, predictions, pipelines and training")
    void shouldReportMetrics() {
        String modelId = TestModels.uniqueId("metrics");
        String pipelineId = TestModels.uniqueId("metrics-p");
        HubMetrics before = hub.getMetrics();

        hub.registerModel(modelId, TestModels.echo()).block();
        hub.predict(modelId, json("[1]"), null).block();
        hub.predict(modelId, json("[2]"), null).block();
        hub.createPipeline(pipelineId, List.of(PipelineStep.predict(modelId))).block();
        hub.executePipeline(pipelineId, json("[3]"), null).block();
        TrainingJob job = hub.trainModel(modelId, json("[1, 2]"), null).block();

        HubMetrics metrics = hub.getMetrics();

        assertThat(job.getResult().getAccuracy()).isEqualTo(1.0);
        assertThat(metrics.getTotalPredictions() - before.getTotalPredictions()).isEqualTo(3);
        assertThat(metrics.getTotalTrainingJobs() - before.getTotalTrainingJobs()).isEqualTo(1);
        assertThat(metrics.getModels().get(modelId).getMetrics().getPredictions()).isEqualTo(3);
        assertThat(metrics.getModels().get(modelId).getMetrics().getAccuracy()).isEqualTo(1.0);
        assertThat(metrics.getModels().get(modelId).getVersion()).isEqualTo("1.0.0");
        assertThat(metrics.getPipelines().get(pipelineId).getExecutions()).isEqualTo(1);
        assertThat(metrics.getTotalModels()).isEqualTo(before.getTotalModels() + 1);
        assertThat(metrics.getAverageInferenceTime()).isGreaterThanOrEqualTo(0.0);
        assertThat(metrics.getActiveJobs()).isZero();
        assertThat(metrics.getPendingInferences()).isZero();

        hub.removePipeline(pipelineId);
        hub.unregisterModel(modelId).block();

        assertThat(hub.getMetrics().getModels()).doesNotContainKey(modelId);
    }

    @Test
    @DisplayName("Observers receive lifecycle events and they are counted")
    void shouldPublishLifecycleEvents() throws Exception {
        String modelId = TestModels.uniqueId("events");
        CompletableFuture<List<LifecycleEvent>> received = hub.events()
            .filter(event -> modelId.equals(event.getSubjectId()))
            .take(3)
            .collectList()
            .toFuture();
        double registeredBefore = meterRegistry.counter("modelhub.events", "type", "model:registered").count();

        hub.registerModel(modelId, TestModels.echo()).block();
        hub.predict(modelId, json("\"hi\""), null).block();
        hub.unregisterModel(modelId).block();

        assertThat(received.get(5, TimeUnit.SECONDS)).extracting(LifecycleEvent::getType).containsExactly(
            EventType.MODEL_REGISTERED,
            EventType.PREDICTION_COMPLETE,
            EventType.MODEL_UNREGISTERED);
        assertThat(meterRegistry.counter("modelhub.events", "type", "model:registered").count())
            .isEqualTo(registeredBefore + 1);
    }

    @Test
    @DisplayName("A slow event observer does not slow down predictions")
    void shouldPredictWhileObserverIsSlow() {
        String modelId = TestModels.uniqueId("slow-observer");
        hub.registerModel(modelId, TestModels.echo()).block();
        Disposable slowObserver = hub.events().subscribe(event -> {
            try {
                Thread.sleep(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        try {
            long start = System.nanoTime();
            hub.predict(modelId, json("[1, 2, 3]"), null).block();
            hub.predict(modelId, json("[4, 5, 6]"), null).block();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(elapsedMs).isLessThan(1000);
        } finally {
            slowObserver.dispose();
            hub.unregisterModel(modelId).block();
        }
    }

    @Test
    @DisplayName("Webhook delivery failures never surface")
    void shouldSwallowWebhookFailures() {
        TrainingJob job = TrainingJob.builder()
            .jobId("train_x_1_1")
            .modelId("x")
            .status(TrainingJobStatus.FAILED)
            .errorMessage("boom")
            .build();

        Mono<Void> missingUrl = webhookNotifier.notify(null, job);
        Mono<Void> unreachable = webhookNotifier.notify("http://127.0.0.1:1/hook", job);

        assertThat(missingUrl.block(Duration.ofSeconds(5))).isNull();
        assertThat(unreachable.block(Duration.ofSeconds(15))).isNull();
    }
}
