package com.whereq.modelhub.training;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.model.TrainingOptions;

/**
 * Per-model replacement for a kind's training data preparation. The returned payload
 * must be what the kind's train capability expects.
 */
@FunctionalInterface
public interface TrainingDataPreparer {
    Object prepare(JsonNode trainingData, TrainingOptions options) throws Exception;
}
