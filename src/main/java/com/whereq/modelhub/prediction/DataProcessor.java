package com.whereq.modelhub.prediction;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Caller-registered pre- or postprocessing function
 */
@FunctionalInterface
public interface DataProcessor {
    JsonNode process(JsonNode data) throws Exception;
}
