package com.whereq.modelhub.pipeline;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * User-supplied step logic: a custom step's body, or a preprocessor, transformer or
 * aggregator that replaces the built-in operation
 */
@FunctionalInterface
public interface StepFunction {
    JsonNode apply(JsonNode data, ExecutionOptions options) throws Exception;
}
