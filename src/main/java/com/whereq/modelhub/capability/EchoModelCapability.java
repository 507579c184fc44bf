package com.whereq.modelhub.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.model.ModelConfig;
import com.whereq.modelhub.model.ModelKind;
import com.whereq.modelhub.model.TrainingOptions;
import com.whereq.modelhub.model.TrainingResult;
import com.whereq.modelhub.storage.ArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Identity model: output equals input
 */
@Slf4j
@Component
public class EchoModelCapability implements ModelCapability {

    @Override
    public ModelKind kind() {
        return ModelKind.ECHO;
    }

    @Override
    public Object load(String modelId, ModelConfig config) {
        return new EchoHandle(modelId);
    }

    @Override
    public JsonNode infer(Object handle, JsonNode input) {
        return input;
    }

    @Override
    public List<JsonNode> inferBatch(Object handle, List<JsonNode> inputs) {
        return List.copyOf(inputs);
    }

    @Override
    public Object prepareTrainingData(Object handle, JsonNode trainingData, TrainingOptions options) {
        return trainingData;
    }

    @Override
    public TrainingResult train(Object handle, Object payload, TrainingOptions options, ProgressSink progress) {
        JsonNode examples = (JsonNode) payload;
        int total = examples != null && examples.isArray() ? examples.size() : 0;

        for (int i = 1; i <= total; i++) {
            progress.onProgress(i * 100.0 / total, Map.of("accuracy", 1.0));
        }
        if (total == 0) {
            progress.onProgress(100.0, Map.of("accuracy", 1.0));
        }

        return TrainingResult.builder()
            .accuracy(1.0)
            .iterations(total)
            .metrics(Map.of("accuracy", 1.0))
            .build();
    }

    @Override
    public void save(Object handle, ArtifactStore store, String path) throws Exception {
        EchoHandle echo = (EchoHandle) handle;
        store.save(path, ("{\"kind\":\"ECHO\",\"modelId\":\"" + echo.modelId() + "\"}")
            .getBytes(StandardCharsets.UTF_8));
    }

    static final class EchoHandle {
        private final String modelId;

        EchoHandle(String modelId) {
            this.modelId = modelId;
        }

        String modelId() {
            return modelId;
        }
    }
}
