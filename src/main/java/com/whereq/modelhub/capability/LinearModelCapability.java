package com.whereq.modelhub.capability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.whereq.modelhub.config.ModelHubProperties;
import com.whereq.modelhub.model.ModelConfig;
import com.whereq.modelhub.model.ModelKind;
import com.whereq.modelhub.model.TrainingOptions;
import com.whereq.modelhub.model.TrainingResult;
import com.whereq.modelhub.storage.ArtifactStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Linear regression trained by full-batch gradient descent
 */
@Slf4j
@Component
public class LinearModelCapability implements ModelCapability {

    @Autowired
    private ArtifactStore artifactStore;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ModelHubProperties properties;

    @Override
    public ModelKind kind() {
        return ModelKind.LINEAR;
    }

    @Override
    public Object load(String modelId, ModelConfig config) throws Exception {
        if (config.getArtifactPath() != null) {
            log.info("Loading linear model {} from artifact {}", modelId, config.getArtifactPath());
            JsonNode saved = objectMapper.readTree(artifactStore.load(config.getArtifactPath()));
            return fromJson(saved);
        }

        JsonNode params = config.getParams();
        if (params != null && params.has("weights")) {
            return fromJson(params);
        }
        if (params != null && params.has("inputSize")) {
            int inputSize = params.get("inputSize").asInt();
            if (inputSize <= 0) {
                throw new IllegalArgumentException("inputSize must be positive: " + inputSize);
            }
            return new LinearModel(new double[inputSize], 0.0);
        }

        throw new IllegalArgumentException("Linear model needs an artifactPath, params.weights or params.inputSize");
    }

    @Override
    public JsonNode infer(Object handle, JsonNode input) {
        LinearModel model = (LinearModel) handle;

        if (input == null || !input.isArray()) {
            throw new IllegalArgumentException("Linear model input must be a numeric array");
        }

        // A matrix is scored row by row
        if (input.size() > 0 && input.get(0).isArray()) {
            ArrayNode outputs = JsonNodeFactory.instance.arrayNode();
            input.forEach(row -> outputs.add(model.predict(toVector(row))));
            return outputs;
        }

        return JsonNodeFactory.instance.numberNode(model.predict(toVector(input)));
    }

    @Override
    public Object prepareTrainingData(Object handle, JsonNode trainingData, TrainingOptions options) {
        LinearModel model = (LinearModel) handle;

        if (trainingData == null || !trainingData.isArray() || trainingData.isEmpty()) {
            throw new IllegalArgumentException("Training data must be a non-empty array of {features, label}");
        }

        int n = trainingData.size();
        double[][] features = new double[n][];
        double[] labels = new double[n];

        for (int i = 0; i < n; i++) {
            JsonNode example = trainingData.get(i);
            if (!example.has("features") || !example.has("label")) {
                throw new IllegalArgumentException("Training example " + i + " lacks features or label");
            }
            features[i] = toVector(example.get("features"));
            if (features[i].length != model.inputSize()) {
                throw new IllegalArgumentException("Training example " + i + " has " + features[i].length
                    + " features, model expects " + model.inputSize());
            }
            labels[i] = example.get("label").asDouble();
        }

        return new TrainingSet(features, labels);
    }

    @Override
    public TrainingResult train(Object handle, Object payload, TrainingOptions options, ProgressSink progress) {
        LinearModel model = (LinearModel) handle;
        TrainingSet data = (TrainingSet) payload;

        int epochs = options.getEpochs() != null ? options.getEpochs() : properties.getTraining().getDefaultEpochs();
        double learningRate = options.getLearningRate() != null
            ? options.getLearningRate()
            : properties.getTraining().getDefaultLearningRate();

        if (epochs <= 0) {
            throw new IllegalArgumentException("epochs must be positive: " + epochs);
        }

        double loss = Double.NaN;
        for (int epoch = 1; epoch <= epochs; epoch++) {
            loss = model.step(data.features(), data.labels(), learningRate);
            if (!Double.isFinite(loss)) {
                throw new ArithmeticException("Training diverged at epoch " + epoch
                    + " (learningRate " + learningRate + ")");
            }
            progress.onProgress(epoch * 100.0 / epochs, Map.of("loss", loss, "epoch", (double) epoch));
        }

        log.debug("Linear training finished after {} epochs, loss={}", epochs, loss);

        return TrainingResult.builder()
            .error(loss)
            .iterations(epochs)
            .metrics(Map.of("loss", loss))
            .build();
    }

    @Override
    public void save(Object handle, ArtifactStore store, String path) throws Exception {
        LinearModel model = (LinearModel) handle;

        ObjectNode json = objectMapper.createObjectNode();
        json.put("kind", ModelKind.LINEAR.name());
        ArrayNode weights = json.putArray("weights");
        for (double w : model.getWeights()) {
            weights.add(w);
        }
        json.put("bias", model.getBias());

        store.save(path, objectMapper.writeValueAsBytes(json));
    }

    private LinearModel fromJson(JsonNode json) {
        JsonNode weights = json.get("weights");
        if (weights == null || !weights.isArray()) {
            throw new IllegalArgumentException("weights must be a numeric array");
        }
        return new LinearModel(toVector(weights), json.path("bias").asDouble(0.0));
    }

    private static double[] toVector(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new IllegalArgumentException("Expected a numeric array but got " + node);
        }
        double[] vector = new double[node.size()];
        for (int i = 0; i < vector.length; i++) {
            JsonNode value = node.get(i);
            if (!value.isNumber()) {
                throw new IllegalArgumentException("Non-numeric feature at index " + i + ": " + value);
            }
            vector[i] = value.asDouble();
        }
        return vector;
    }

    /**
     * Training payload produced by {@link #prepareTrainingData}
     */
    static final class TrainingSet {
        private final double[][] features;
        private final double[] labels;

        TrainingSet(double[][] features, double[] labels) {
            this.features = features;
            this.labels = labels;
        }

        double[][] features() {
            return features;
        }

        double[] labels() {
            return labels;
        }
    }
}
