package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

import static com.whereq.modelhub.pipeline.JsonArrays.NODES;

/**
 * Built-in transform operations. Pure functions of data and params.
 */
public final class Transformers {

    private Transformers() {
    }

    public static JsonNode apply(TransformOperation operation, JsonNode data, JsonNode params) {
        return switch (operation) {
            case RESHAPE -> reshape(data, params);
            case FILTER -> filter(data, params);
            case MAP -> map(data, params);
        };
    }

    /**
     * Rearrange the leaves of a (nested) array into {@code shape}. One dimension may be -1
     * and is inferred.
     */
    static JsonNode reshape(JsonNode data, JsonNode params) {
        if (params == null || !params.has("shape") || !params.get("shape").isArray()) {
            throw new IllegalArgumentException("reshape requires a shape parameter");
        }

        List<JsonNode> leaves = new ArrayList<>();
        flatten(data, leaves);

        JsonNode shapeNode = params.get("shape");
        int[] shape = new int[shapeNode.size()];
        int inferred = -1;
        int known = 1;
        for (int i = 0; i < shape.length; i++) {
            shape[i] = shapeNode.get(i).asInt();
            if (shape[i] == -1) {
                if (inferred >= 0) {
                    throw new IllegalArgumentException("reshape allows only one inferred dimension");
                }
                inferred = i;
            } else if (shape[i] <= 0) {
                throw new IllegalArgumentException("Invalid reshape dimension: " + shape[i]);
            } else {
                known *= shape[i];
            }
        }

        if (inferred >= 0) {
            if (leaves.size() % known != 0) {
                throw new IllegalArgumentException("Cannot infer dimension: " + leaves.size()
                    + " elements into blocks of " + known);
            }
            shape[inferred] = leaves.size() / known;
        } else if (known != leaves.size()) {
            throw new IllegalArgumentException("Cannot reshape " + leaves.size() + " elements into "
                + shapeNode);
        }

        int[] cursor = {0};
        return build(leaves, shape, 0, cursor);
    }

    private static void flatten(JsonNode node, List<JsonNode> leaves) {
        if (node != null && node.isArray()) {
            node.forEach(child -> flatten(child, leaves));
        } else {
            leaves.add(node);
        }
    }

    private static JsonNode build(List<JsonNode> leaves, int[] shape, int dim, int[] cursor) {
        ArrayNode array = NODES.arrayNode(shape[dim]);
        for (int i = 0; i < shape[dim]; i++) {
            if (dim == shape.length - 1) {
                array.add(leaves.get(cursor[0]++));
            } else {
                array.add(build(leaves, shape, dim + 1, cursor));
            }
        }
        return array;
    }

    /**
     * Keep array elements matching every given condition: {@code min}, {@code max},
     * {@code equals}. With {@code field}, conditions apply to that field of each element.
     */
    static JsonNode filter(JsonNode data, JsonNode params) {
        if (data == null || !data.isArray()) {
            throw new IllegalArgumentException("filter expects an array");
        }
        if (params == null || !(params.has("min") || params.has("max") || params.has("equals"))) {
            throw new IllegalArgumentException("filter requires min, max or equals");
        }

        String field = JsonArrays.param(params, "field", null);
        ArrayNode kept = NODES.arrayNode();

        for (JsonNode element : data) {
            JsonNode value = field != null ? element.get(field) : element;
            if (value != null && matches(value, params)) {
                kept.add(element);
            }
        }
        return kept;
    }

    private static boolean matches(JsonNode value, JsonNode params) {
        if (params.has("equals") && !params.get("equals").equals(value)) {
            return false;
        }
        if (params.has("min") || params.has("max")) {
            if (!value.isNumber()) {
                return false;
            }
            double v = value.asDouble();
            if (params.has("min") && v < params.get("min").asDouble()) {
                return false;
            }
            if (params.has("max") && v > params.get("max").asDouble()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Apply {@code op} to every element (recursively through nested arrays):
     * scale ({@code factor}), offset ({@code value}), abs, round ({@code digits}),
     * pick ({@code field} of each object).
     */
    static JsonNode map(JsonNode data, JsonNode params) {
        String op = JsonArrays.param(params, "op", null);
        if (op == null) {
            throw new IllegalArgumentException("map requires an op parameter");
        }

        return switch (op) {
            case "scale" -> mapNumbers(data, v -> v * JsonArrays.param(params, "factor", 1.0));
            case "offset" -> mapNumbers(data, v -> v + JsonArrays.param(params, "value", 0.0));
            case "abs" -> mapNumbers(data, Math::abs);
            case "round" -> {
                int digits = (int) JsonArrays.param(params, "digits", 0.0);
                yield mapNumbers(data, v -> BigDecimal.valueOf(v).setScale(digits, RoundingMode.HALF_UP)
                    .doubleValue());
            }
            case "pick" -> pick(data, JsonArrays.param(params, "field", null));
            default -> throw new IllegalArgumentException("Unknown map op: " + op);
        };
    }

    private static JsonNode mapNumbers(JsonNode data, DoubleUnaryOperator fn) {
        if (data != null && data.isArray()) {
            ArrayNode mapped = NODES.arrayNode(data.size());
            data.forEach(element -> mapped.add(mapNumbers(element, fn)));
            return mapped;
        }
        if (data == null || !data.isNumber()) {
            throw new IllegalArgumentException("map expects numbers but got " + data);
        }
        return NODES.numberNode(fn.applyAsDouble(data.asDouble()));
    }

    private static JsonNode pick(JsonNode data, String field) {
        if (field == null) {
            throw new IllegalArgumentException("map op pick requires a field parameter");
        }
        if (data != null && data.isArray()) {
            ArrayNode picked = NODES.arrayNode(data.size());
            data.forEach(element -> picked.add(element.path(field).isMissingNode()
                ? NODES.nullNode()
                : element.get(field)));
            return picked;
        }
        if (data == null || !data.isObject()) {
            throw new IllegalArgumentException("map op pick expects objects but got " + data);
        }
        return data.has(field) ? data.get(field) : NODES.nullNode();
    }
}
