package com.whereq.modelhub.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.TestModels;
import com.whereq.modelhub.TestModels.CountingModel;
import com.whereq.modelhub.capability.CustomModel;
import com.whereq.modelhub.capability.ModelCapability;
import com.whereq.modelhub.dto.ModelInfo;
import com.whereq.modelhub.exception.DuplicateModelException;
import com.whereq.modelhub.exception.ModelLoadException;
import com.whereq.modelhub.exception.NotFoundException;
import com.whereq.modelhub.exception.NotReadyException;
import com.whereq.modelhub.model.ModelConfig;
import com.whereq.modelhub.model.ModelKind;
import com.whereq.modelhub.model.ModelStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@SpringBootTest
@ActiveProfiles("test")
@DisplayName("ModelRegistry Integration Tests")
class ModelRegistryTest {

    @Autowired
    private ModelRegistry registry;

    @Test
    @DisplayName("Registering a model makes it READY and listable")
    void shouldRegisterModel() {
        String modelId = TestModels.uniqueId("reg");

        StepVerifier.create(registry.register(modelId, TestModels.echo()))
            .assertNext(info -> {
                assertThat(info.getModelId()).isEqualTo(modelId);
                assertThat(info.getKind()).isEqualTo(ModelKind.ECHO);
                assertThat(info.getStatus()).isEqualTo(ModelStatus.READY);
                assertThat(info.getVersion()).isEqualTo("1.0.0");
                assertThat(info.getMetrics().getPredictions()).isZero();
            })
            .verifyComplete();

        assertThat(registry.get(modelId).getStatus()).isEqualTo(ModelStatus.READY);
        assertThat(registry.listModels()).extracting(ModelInfo::getModelId).contains(modelId);

        registry.unregister(modelId).block();
    }

    @Test
    @DisplayName("A READY id cannot be registered twice")
    void shouldRejectDuplicate() {
        String modelId = TestModels.uniqueId("dup");
        registry.register(modelId, TestModels.echo()).block();

        StepVerifier.create(registry.register(modelId, TestModels.echo()))
            .expectError(DuplicateModelException.class)
            .verify();

        registry.unregister(modelId).block();
    }

    @Test
    @DisplayName("A failed load leaves a FAILED entry that can be replaced")
    void shouldRecordFailedLoad() {
        String modelId = TestModels.uniqueId("failed");
        ModelConfig broken = ModelConfig.builder().kind(ModelKind.LINEAR).build();

        StepVerifier.create(registry.register(modelId, broken))
            .expectError(ModelLoadException.class)
            .verify();

        assertThat(registry.describe(modelId).getStatus()).isEqualTo(ModelStatus.FAILED);
        assertThat(registry.describe(modelId).getErrorMessage()).isNotBlank();
        assertThatThrownBy(() -> registry.get(modelId)).isInstanceOf(NotReadyException.class);

        StepVerifier.create(registry.register(modelId, TestModels.echo()))
            .assertNext(info -> assertThat(info.getStatus()).isEqualTo(ModelStatus.READY))
            .verifyComplete();

        registry.unregister(modelId).block();
    }

    @Test
    @DisplayName("A loader returning nothing fails the load")
    void shouldFailOnNullHandle() {
        String modelId = TestModels.uniqueId("null");
        ModelConfig config = ModelConfig.builder().kind(ModelKind.CUSTOM).loader(() -> null).build();

        StepVerifier.create(registry.register(modelId, config))
            .expectError(ModelLoadException.class)
            .verify();

        registry.unregister(modelId).block();
    }

    @Test
    @DisplayName("Unregistering disposes the handle and removes the model")
    void shouldUnregisterAndDispose() {
        String modelId = TestModels.uniqueId("unreg");
        CountingModel model = new CountingModel();
        registry.register(modelId, TestModels.custom(model)).block();

        StepVerifier.create(registry.unregister(modelId)).verifyComplete();

        assertThat(model.closed).isTrue();
        assertThat(registry.contains(modelId)).isFalse();
        assertThatThrownBy(() -> registry.get(modelId)).isInstanceOf(NotFoundException.class);
        StepVerifier.create(registry.unregister(modelId))
            .expectError(NotFoundException.class)
            .verify();
    }

    @Test
    @DisplayName("Disposal waits for in-flight use of the handle")
    void shouldWaitForInFlightUse() throws Exception {
        String modelId = TestModels.uniqueId("inflight");
        AtomicBoolean closed = new AtomicBoolean();
        CustomModel model = new CustomModel() {
            @Override
            public JsonNode predict(JsonNode input) {
                return input;
            }

            @Override
            public void close() {
                closed.set(true);
            }
        };
        registry.register(modelId, TestModels.custom(model)).block();

        CountDownLatch inUse = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<Boolean> user = CompletableFuture.supplyAsync(() -> {
                try {
                    return registry.useModel(modelId, (capability, handle) -> {
                        inUse.countDown();
                        finish.await(5, TimeUnit.SECONDS);
                        return closed.get();
                    });
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }, executor);

            assertThat(inUse.await(5, TimeUnit.SECONDS)).isTrue();
            Disposable unregistering = registry.unregister(modelId).subscribe();

            Thread.sleep(200);
            assertThat(registry.contains(modelId)).isFalse();
            assertThat(closed).isFalse();

            finish.countDown();
            assertThat(user.get(5, TimeUnit.SECONDS)).isFalse();

            long deadline = System.currentTimeMillis() + 5000;
            while (!closed.get() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertThat(closed).isTrue();
            unregistering.dispose();
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Concurrent usage updates are never lost")
    void shouldCountConcurrentUsage() throws Exception {
        String modelId = TestModels.uniqueId("usage");
        registry.register(modelId, TestModels.echo()).block();
        long before = registry.getTotalPredictions();

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch done = new CountDownLatch(8);
            for (int t = 0; t < 8; t++) {
                executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        registry.recordUsage(modelId, 1.0);
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        ModelInfo info = registry.get(modelId);
        assertThat(info.getMetrics().getPredictions()).isEqualTo(4000);
        assertThat(info.getMetrics().getTotalInferenceTime()).isCloseTo(4000.0, within(1e-6));
        assertThat(info.getMetrics().getLastUsed()).isNotNull();
        assertThat(registry.getTotalPredictions() - before).isGreaterThanOrEqualTo(4000);

        registry.unregister(modelId).block();
    }

    @Test
    @DisplayName("Models are saved through their capability")
    void shouldSaveModel() throws Exception {
        String modelId = TestModels.uniqueId("save");
        ModelConfig config = ModelConfig.builder()
            .kind(ModelKind.LINEAR)
            .params(TestModels.json("{\"weights\": [1, 2], \"bias\": 3}"))
            .build();
        registry.register(modelId, config).block();

        String path = registry.saveModel(modelId, null);

        assertThat(path).isEqualTo(modelId + "/model.json");
        String reloaded = TestModels.uniqueId("reload");
        ModelInfo info = registry.register(reloaded, ModelConfig.builder()
            .kind(ModelKind.LINEAR)
            .artifactPath(path)
            .build()).block();
        assertThat(info.getStatus()).isEqualTo(ModelStatus.READY);

        registry.unregister(modelId).block();
        registry.unregister(reloaded).block();
    }

    @Test
    @DisplayName("A model unregistered while loading is closed once and registration fails")
    void shouldCloseModelUnregisteredWhileLoading() {
        String modelId = TestModels.uniqueId("orphan");
        CountingModel model = new CountingModel();
        ModelConfig config = ModelConfig.builder()
            .kind(ModelKind.CUSTOM)
            .loader(() -> {
                registry.unregister(modelId).block(Duration.ofSeconds(5));
                return model;
            })
            .build();

        StepVerifier.create(registry.register(modelId, config))
            .expectError(NotFoundException.class)
            .verify(Duration.ofSeconds(10));

        assertThat(model.closed).isTrue();
        assertThat(registry.contains(modelId)).isFalse();
    }

    @Test
    @DisplayName("An orphaned entry whose handle was already released is not disposed again")
    void shouldNotDisposeReleasedHandle() throws Exception {
        ModelCapability capability = mock(ModelCapability.class);
        RegisteredModel entry = new RegisteredModel("released", TestModels.echo());
        entry.markReady(new Object());
        entry.releaseHandle();

        registry.disposeOrphan(capability, entry);

        verify(capability, never()).dispose(any());
    }

    @Test
    @DisplayName("An orphaned entry still holding its handle is disposed")
    void shouldDisposeHeldHandle() throws Exception {
        ModelCapability capability = mock(ModelCapability.class);
        Object handle = new Object();
        RegisteredModel entry = new RegisteredModel("held", TestModels.echo());
        entry.markReady(handle);

        registry.disposeOrphan(capability, entry);

        verify(capability, times(1)).dispose(handle);
    }

    @Test
    @DisplayName("Registration requires a kind")
    void shouldRequireKind() {
        StepVerifier.create(registry.register(TestModels.uniqueId("nokind"), new ModelConfig()))
            .expectError(IllegalArgumentException.class)
            .verify(Duration.ofSeconds(5));
    }
}
