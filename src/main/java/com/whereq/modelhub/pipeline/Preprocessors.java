package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import static com.whereq.modelhub.pipeline.JsonArrays.NODES;

/**
 * Built-in preprocess operations. Pure functions of data and params.
 */
public final class Preprocessors {

    private static final Pattern WORD_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}_]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Preprocessors() {
    }

    public static JsonNode apply(PreprocessOperation operation, JsonNode data, JsonNode params) {
        return switch (operation) {
            case NORMALIZE -> normalize(data, params);
            case TOKENIZE -> tokenize(data, params);
            case VECTORIZE -> vectorize(data, params);
        };
    }

    /**
     * Scale a numeric array. {@code method}: minmax (default, into {@code featureRange},
     * default [0, 1]) or zscore.
     */
    static JsonNode normalize(JsonNode data, JsonNode params) {
        double[] values = JsonArrays.toVector(data, "normalize");
        String method = JsonArrays.param(params, "method", "minmax");

        switch (method) {
            case "minmax" -> {
                double low = 0.0;
                double high = 1.0;
                if (params != null && params.has("featureRange")) {
                    double[] range = JsonArrays.toVector(params.get("featureRange"), "featureRange");
                    if (range.length != 2) {
                        throw new IllegalArgumentException("featureRange must have two bounds");
                    }
                    low = range[0];
                    high = range[1];
                }

                double min = Double.POSITIVE_INFINITY;
                double max = Double.NEGATIVE_INFINITY;
                for (double v : values) {
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
                double span = max - min;

                double[] scaled = new double[values.length];
                for (int i = 0; i < values.length; i++) {
                    // Constant input maps to the lower bound
                    scaled[i] = span == 0 ? low : (values[i] - min) / span * (high - low) + low;
                }
                return JsonArrays.toArray(scaled);
            }
            case "zscore" -> {
                if (values.length == 0) {
                    return JsonArrays.toArray(values);
                }
                double mean = 0;
                for (double v : values) {
                    mean += v;
                }
                mean /= values.length;

                double variance = 0;
                for (double v : values) {
                    variance += (v - mean) * (v - mean);
                }
                double stdDev = Math.sqrt(variance / values.length);

                double[] scaled = new double[values.length];
                for (int i = 0; i < values.length; i++) {
                    scaled[i] = stdDev == 0 ? 0.0 : (values[i] - mean) / stdDev;
                }
                return JsonArrays.toArray(scaled);
            }
            default -> throw new IllegalArgumentException("Unknown normalize method: " + method);
        }
    }

    /**
     * Split text into tokens. Accepts a string or an array of strings.
     * {@code type}: word (default) or whitespace; {@code lowercase} default true.
     */
    static JsonNode tokenize(JsonNode data, JsonNode params) {
        String type = JsonArrays.param(params, "type", "word");
        boolean lowercase = params == null || !params.has("lowercase") || params.get("lowercase").asBoolean();

        Pattern separator = switch (type) {
            case "word" -> WORD_SEPARATOR;
            case "whitespace" -> WHITESPACE;
            default -> throw new IllegalArgumentException("Unknown tokenizer type: " + type);
        };

        if (data != null && data.isArray()) {
            ArrayNode documents = NODES.arrayNode(data.size());
            data.forEach(text -> documents.add(tokens(text, separator, lowercase)));
            return documents;
        }
        return tokens(data, separator, lowercase);
    }

    private static ArrayNode tokens(JsonNode text, Pattern separator, boolean lowercase) {
        if (text == null || !text.isTextual()) {
            throw new IllegalArgumentException("tokenize expects text but got " + text);
        }
        ArrayNode tokens = NODES.arrayNode();
        for (String token : separator.split(text.asText())) {
            if (!token.isEmpty()) {
                tokens.add(lowercase ? token.toLowerCase() : token);
            }
        }
        return tokens;
    }

    /**
     * One-hot encode token lists against {@code vocabulary}, or against the tokens seen in
     * order of first appearance. A single token list yields a single vector.
     */
    static JsonNode vectorize(JsonNode data, JsonNode params) {
        String method = JsonArrays.param(params, "method", "onehot");
        if (!"onehot".equals(method)) {
            throw new IllegalArgumentException("Unknown vectorize method: " + method);
        }
        if (data == null || !data.isArray()) {
            throw new IllegalArgumentException("vectorize expects an array of token lists");
        }

        boolean single = data.size() > 0 && !data.get(0).isArray();
        JsonNode documents = single ? NODES.arrayNode().add(data) : data;

        Map<String, Integer> vocabIndex = new LinkedHashMap<>();
        JsonNode vocabulary = params != null ? params.get("vocabulary") : null;
        if (vocabulary != null && vocabulary.isArray()) {
            vocabulary.forEach(word -> vocabIndex.putIfAbsent(word.asText(), vocabIndex.size()));
        } else {
            documents.forEach(tokens -> tokens.forEach(token -> vocabIndex.putIfAbsent(token.asText(),
                vocabIndex.size())));
        }

        ArrayNode vectors = NODES.arrayNode(documents.size());
        for (JsonNode tokens : documents) {
            if (!tokens.isArray()) {
                throw new IllegalArgumentException("vectorize expects every document to be a token list");
            }
            double[] vector = new double[vocabIndex.size()];
            tokens.forEach(token -> {
                Integer index = vocabIndex.get(token.asText());
                if (index != null) {
                    vector[index] = 1.0;
                }
            });
            vectors.add(JsonArrays.toArray(vector));
        }

        return single ? vectors.get(0) : vectors;
    }
}
