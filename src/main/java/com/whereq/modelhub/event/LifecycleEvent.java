package com.whereq.modelhub.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Structured lifecycle event
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleEvent {
    private EventType type;

    /**
     * Model, pipeline or job id the event is about
     */
    private String subjectId;

    @Builder.Default
    private Instant timestamp = Instant.now();

    /**
     * Event payload; never contains model handles
     */
    private Map<String, Object> attributes;

    public static LifecycleEvent of(EventType type, String subjectId, Map<String, Object> attributes) {
        return LifecycleEvent.builder()
            .type(type)
            .subjectId(subjectId)
            .attributes(attributes)
            .build();
    }
}
