package com.whereq.modelhub.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.model.TrainingOptions;
import com.whereq.modelhub.model.TrainingResult;
import com.whereq.modelhub.storage.ArtifactStore;

import java.util.ArrayList;
import java.util.List;

/**
 * A model supplied by the caller for the CUSTOM kind
 */
public interface CustomModel {

    JsonNode predict(JsonNode input) throws Exception;

    default List<JsonNode> predictBatch(List<JsonNode> inputs) throws Exception {
        List<JsonNode> outputs = new ArrayList<>(inputs.size());
        for (JsonNode input : inputs) {
            outputs.add(predict(input));
        }
        return outputs;
    }

    default TrainingResult train(JsonNode trainingData, TrainingOptions options, ProgressSink progress)
            throws Exception {
        throw new UnsupportedOperationException("Training not supported by " + getClass().getSimpleName());
    }

    default void save(ArtifactStore store, String path) throws Exception {
        // Default: nothing to persist
    }

    default void close() throws Exception {
    }
}
