package com.whereq.modelhub.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.model.ModelConfig;
import com.whereq.modelhub.model.ModelKind;
import com.whereq.modelhub.model.TrainingOptions;
import com.whereq.modelhub.model.TrainingResult;
import com.whereq.modelhub.storage.ArtifactStore;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Delegates every operation to the caller-supplied {@link CustomModel}
 */
@Component
public class CustomModelCapability implements ModelCapability {

    @Override
    public ModelKind kind() {
        return ModelKind.CUSTOM;
    }

    @Override
    public Object load(String modelId, ModelConfig config) {
        if (config.getLoader() == null) {
            throw new IllegalArgumentException("Custom model loader required for " + modelId);
        }
        CustomModel model = config.getLoader().get();
        if (model == null) {
            throw new IllegalStateException("Custom model loader returned null for " + modelId);
        }
        return model;
    }

    @Override
    public JsonNode infer(Object handle, JsonNode input) throws Exception {
        return ((CustomModel) handle).predict(input);
    }

    @Override
    public List<JsonNode> inferBatch(Object handle, List<JsonNode> inputs) throws Exception {
        return ((CustomModel) handle).predictBatch(inputs);
    }

    @Override
    public Object prepareTrainingData(Object handle, JsonNode trainingData, TrainingOptions options) {
        return trainingData;
    }

    @Override
    public TrainingResult train(Object handle, Object payload, TrainingOptions options, ProgressSink progress)
            throws Exception {
        return ((CustomModel) handle).train((JsonNode) payload, options, progress);
    }

    @Override
    public void save(Object handle, ArtifactStore store, String path) throws Exception {
        ((CustomModel) handle).save(store, path);
    }

    @Override
    public void dispose(Object handle) throws Exception {
        ((CustomModel) handle).close();
    }
}
