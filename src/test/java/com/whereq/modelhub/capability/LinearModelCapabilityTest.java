package com.whereq.modelhub.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.modelhub.config.ModelHubProperties;
import com.whereq.modelhub.model.ModelConfig;
import com.whereq.modelhub.model.ModelKind;
import com.whereq.modelhub.model.TrainingOptions;
import com.whereq.modelhub.model.TrainingResult;
import com.whereq.modelhub.storage.FileSystemArtifactStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("LinearModelCapability Unit Tests")
class LinearModelCapabilityTest {

    @TempDir
    Path root;

    private final ObjectMapper mapper = new ObjectMapper();

    private FileSystemArtifactStore store;

    private LinearModelCapability capability;

    @BeforeEach
    void setUp() {
        store = new FileSystemArtifactStore(root);
        capability = new LinearModelCapability();
        ReflectionTestUtils.setField(capability, "artifactStore", store);
        ReflectionTestUtils.setField(capability, "objectMapper", mapper);
        ReflectionTestUtils.setField(capability, "properties", new ModelHubProperties());
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    @DisplayName("Infers w.x + b from weights in params")
    void shouldInferFromParams() throws Exception {
        Object handle = capability.load("lin", ModelConfig.builder()
            .kind(ModelKind.LINEAR)
            .params(json("{\"weights\": [2, -1], \"bias\": 0.5}"))
            .build());

        assertThat(capability.infer(handle, json("[3, 1]")).asDouble()).isEqualTo(5.5);
        JsonNode rows = capability.infer(handle, json("[[1, 0], [0, 1]]"));
        assertThat(rows.size()).isEqualTo(2);
        assertThat(rows.get(0).asDouble()).isEqualTo(2.5);
        assertThat(rows.get(1).asDouble()).isEqualTo(-0.5);
    }

    @Test
    @DisplayName("Rejects inputs of the wrong width")
    void shouldRejectWrongWidth() throws Exception {
        Object handle = capability.load("lin", ModelConfig.builder()
            .kind(ModelKind.LINEAR)
            .params(json("{\"inputSize\": 2}"))
            .build());
        JsonNode input = json("[1, 2, 3]");

        assertThatThrownBy(() -> capability.infer(handle, input))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Requires weights, inputSize or an artifact")
    void shouldRequireInitialState() {
        ModelConfig config = ModelConfig.builder().kind(ModelKind.LINEAR).build();

        assertThatThrownBy(() -> capability.load("lin", config))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Gradient descent lowers the loss and reports progress every epoch")
    void shouldTrainWithProgress() throws Exception {
        Object handle = capability.load("lin", ModelConfig.builder()
            .kind(ModelKind.LINEAR)
            .params(json("{\"inputSize\": 1}"))
            .build());
        JsonNode data = json("[{\"features\": [1], \"label\": 2}, {\"features\": [2], \"label\": 4},"
            + " {\"features\": [3], \"label\": 6}]");
        TrainingOptions options = TrainingOptions.builder().epochs(1000).learningRate(0.05).build();
        List<Double> progress = new ArrayList<>();

        Object payload = capability.prepareTrainingData(handle, data, options);
        TrainingResult result = capability.train(handle, payload, options,
            (percent, metrics) -> progress.add(percent));

        assertThat(progress).hasSize(1000);
        assertThat(progress.get(0)).isCloseTo(0.1, within(1e-9));
        assertThat(progress.get(999)).isEqualTo(100.0);
        assertThat(result.getIterations()).isEqualTo(1000);
        assertThat(result.getError()).isLessThan(0.01);
        assertThat(capability.infer(handle, json("[4]")).asDouble()).isCloseTo(8.0, within(0.3));
    }

    @Test
    @DisplayName("Training examples must match the model width")
    void shouldRejectMismatchedTrainingData() throws Exception {
        Object handle = capability.load("lin", ModelConfig.builder()
            .kind(ModelKind.LINEAR)
            .params(json("{\"inputSize\": 2}"))
            .build());
        JsonNode data = json("[{\"features\": [1], \"label\": 2}]");

        assertThatThrownBy(() -> capability.prepareTrainingData(handle, data, TrainingOptions.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("features");
    }

    @Test
    @DisplayName("Saved weights load back into an equivalent model")
    void shouldSaveAndReload() throws Exception {
        Object handle = capability.load("lin", ModelConfig.builder()
            .kind(ModelKind.LINEAR)
            .params(json("{\"weights\": [1.5], \"bias\": -1}"))
            .build());

        capability.save(handle, store, "lin/model.json");
        Object reloaded = capability.load("lin", ModelConfig.builder()
            .kind(ModelKind.LINEAR)
            .artifactPath("lin/model.json")
            .build());

        assertThat(capability.infer(reloaded, json("[2]")).asDouble()).isEqualTo(2.0);
    }
}
