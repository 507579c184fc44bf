package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.whereq.modelhub.pipeline.JsonArrays.NODES;

/**
 * Built-in aggregate operations. Pure functions of data and params.
 */
public final class Aggregators {

    private Aggregators() {
    }

    public static JsonNode apply(AggregateOperation operation, JsonNode data, JsonNode params) {
        return switch (operation) {
            case MEAN -> mean(data);
            case ENSEMBLE -> ensemble(data, params);
            case VOTE -> vote(data);
        };
    }

    /**
     * Mean of a numeric array, or element-wise mean of equally sized vectors
     */
    static JsonNode mean(JsonNode data) {
        if (JsonArrays.isMatrix(data)) {
            return weightedAverage(data, null);
        }
        double[] values = JsonArrays.toVector(data, "mean");
        if (values.length == 0) {
            throw new IllegalArgumentException("mean of an empty array");
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return NODES.numberNode(sum / values.length);
    }

    /**
     * Weighted element-wise average of prediction vectors ({@code weights}, default equal).
     * A flat array of scores gives a weighted mean.
     */
    static JsonNode ensemble(JsonNode data, JsonNode params) {
        double[] weights = params != null && params.has("weights")
            ? JsonArrays.toVector(params.get("weights"), "weights")
            : null;

        if (JsonArrays.isMatrix(data)) {
            return weightedAverage(data, weights);
        }

        double[] values = JsonArrays.toVector(data, "ensemble");
        if (values.length == 0) {
            throw new IllegalArgumentException("ensemble of an empty array");
        }
        double[] w = checkWeights(weights, values.length);
        double sum = 0;
        double weightSum = 0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i] * w[i];
            weightSum += w[i];
        }
        return NODES.numberNode(sum / weightSum);
    }

    /**
     * Majority label. Probability vectors vote for their argmax index. Ties go to the
     * label seen first.
     */
    static JsonNode vote(JsonNode data) {
        if (data == null || !data.isArray() || data.isEmpty()) {
            throw new IllegalArgumentException("vote expects a non-empty array");
        }

        Map<JsonNode, Integer> counts = new LinkedHashMap<>();
        for (JsonNode ballot : data) {
            JsonNode label = ballot.isArray() ? NODES.numberNode(argmax(JsonArrays.toVector(ballot, "vote"))) : ballot;
            counts.merge(label, 1, Integer::sum);
        }

        JsonNode winner = null;
        int best = 0;
        for (Map.Entry<JsonNode, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > best) {
                winner = entry.getKey();
                best = entry.getValue();
            }
        }

        ObjectNode result = NODES.objectNode();
        result.set("label", winner);
        result.put("votes", best);
        result.put("total", data.size());
        return result;
    }

    private static JsonNode weightedAverage(JsonNode rows, double[] weights) {
        int width = rows.get(0).size();
        double[] w = checkWeights(weights, rows.size());
        double[] sums = new double[width];
        double weightSum = 0;

        for (int r = 0; r < rows.size(); r++) {
            double[] row = JsonArrays.toVector(rows.get(r), "aggregate");
            if (row.length != width) {
                throw new IllegalArgumentException("Vectors differ in length: " + width + " vs " + row.length);
            }
            for (int i = 0; i < width; i++) {
                sums[i] += row[i] * w[r];
            }
            weightSum += w[r];
        }

        for (int i = 0; i < width; i++) {
            sums[i] /= weightSum;
        }
        return JsonArrays.toArray(sums);
    }

    private static double[] checkWeights(double[] weights, int count) {
        if (weights == null) {
            double[] equal = new double[count];
            Arrays.fill(equal, 1.0);
            return equal;
        }
        if (weights.length != count) {
            throw new IllegalArgumentException("Expected " + count + " weights but got " + weights.length);
        }
        double total = 0;
        for (double w : weights) {
            total += w;
        }
        if (total <= 0) {
            throw new IllegalArgumentException("Weights must sum to a positive value");
        }
        return weights;
    }

    private static int argmax(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("vote ballot is empty");
        }
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }
}
