package com.whereq.modelhub.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.modelhub.model.PredictionOptions;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.MonoSink;

import java.time.Instant;

/**
 * A pending inference request and the channel back to its caller
 */
@Getter
@RequiredArgsConstructor
class QueuedInferenceRequest {
    private final String modelId;
    private final JsonNode input;
    private final PredictionOptions options;
    private final MonoSink<JsonNode> sink;
    private final Instant enqueuedAt;
}
