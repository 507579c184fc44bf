package com.whereq.modelhub.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.model.ModelConfig;
import com.whereq.modelhub.model.ModelKind;
import com.whereq.modelhub.model.TrainingOptions;
import com.whereq.modelhub.model.TrainingResult;
import com.whereq.modelhub.storage.ArtifactStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Computation capability of one model kind. Implementations are blocking and are
 * always invoked off the event loop.
 *
 * <p>The handle returned by {@link #load} is owned by the registry entry; every other
 * method receives it back from the registry and must not retain it.</p>
 */
public interface ModelCapability {

    /**
     * @return the kind this capability serves
     */
    ModelKind kind();

    /**
     * Create the handle for a model
     *
     * @param modelId model identifier
     * @param config registration config
     * @return loaded handle, never null
     * @throws Exception if the model cannot be loaded
     */
    Object load(String modelId, ModelConfig config) throws Exception;

    /**
     * Run inference for one input
     */
    JsonNode infer(Object handle, JsonNode input) throws Exception;

    /**
     * Run inference for a batch of inputs. Output i belongs to input i.
     */
    default List<JsonNode> inferBatch(Object handle, List<JsonNode> inputs) throws Exception {
        List<JsonNode> outputs = new ArrayList<>(inputs.size());
        for (JsonNode input : inputs) {
            outputs.add(infer(handle, input));
        }
        return outputs;
    }

    /**
     * Turn raw training data into the payload {@link #train} expects
     */
    Object prepareTrainingData(Object handle, JsonNode trainingData, TrainingOptions options) throws Exception;

    /**
     * Train the model in place, reporting progress through the sink
     */
    TrainingResult train(Object handle, Object payload, TrainingOptions options, ProgressSink progress)
        throws Exception;

    /**
     * Persist the model
     */
    void save(Object handle, ArtifactStore store, String path) throws Exception;

    /**
     * Release resources held by the handle
     */
    default void dispose(Object handle) throws Exception {
        // Default: nothing to release
    }
}
