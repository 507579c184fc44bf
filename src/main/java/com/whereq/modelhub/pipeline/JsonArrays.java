package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Numeric helpers shared by the built-in step operations
 */
final class JsonArrays {

    static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JsonArrays() {
    }

    static double[] toVector(JsonNode node, String operation) {
        if (node == null || !node.isArray()) {
            throw new IllegalArgumentException(operation + " expects a numeric array but got "
                + (node == null ? "null" : node.getNodeType()));
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode value = node.get(i);
            if (!value.isNumber()) {
                throw new IllegalArgumentException(operation + " expects numbers, element " + i + " is " + value);
            }
            values[i] = value.asDouble();
        }
        return values;
    }

    static ArrayNode toArray(double[] values) {
        ArrayNode array = NODES.arrayNode(values.length);
        for (double value : values) {
            array.add(value);
        }
        return array;
    }

    static boolean isMatrix(JsonNode node) {
        return node != null && node.isArray() && node.size() > 0 && node.get(0).isArray();
    }

    static double param(JsonNode params, String name, double defaultValue) {
        if (params == null || !params.has(name)) {
            return defaultValue;
        }
        JsonNode value = params.get(name);
        if (!value.isNumber()) {
            throw new IllegalArgumentException("Parameter " + name + " must be a number: " + value);
        }
        return value.asDouble();
    }

    static String param(JsonNode params, String name, String defaultValue) {
        return params != null && params.hasNonNull(name) ? params.get(name).asText() : defaultValue;
    }
}
