package com.whereq.modelhub.event;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.EnumMap;
import java.util.Map;

/**
 * Event sink for lifecycle events: logs them, counts them and multicasts them to observers
 */
@Slf4j
@Component
public class LifecycleEventPublisher {

    /**
     * Events buffered per observer before further ones are dropped for it
     */
    static final int OBSERVER_BUFFER = 256;

    @Autowired
    private MeterRegistry meterRegistry;

    private final Map<EventType, Counter> counters = new EnumMap<>(EventType.class);

    private final Sinks.Many<LifecycleEvent> sink = Sinks.many().multicast().directBestEffort();

    public LifecycleEventPublisher() {
    }

    public LifecycleEventPublisher(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        initialize();
    }

    @PostConstruct
    public void initialize() {
        for (EventType type : EventType.values()) {
            counters.put(type, Counter.builder("modelhub.events")
                .tag("type", type.eventName())
                .description("Number of lifecycle events emitted")
                .register(meterRegistry));
        }
    }

    /**
     * Publish an event. Never blocks and never throws: observers that cannot keep up miss events.
     *
     * @param event the event
     */
    public void publish(LifecycleEvent event) {
        counters.get(event.getType()).increment();

        if (event.getType() == EventType.TRAINING_PROGRESS || event.getType() == EventType.PREDICTION_COMPLETE) {
            log.debug("{} {} {}", event.getType().eventName(), event.getSubjectId(), event.getAttributes());
        } else if (event.getType().eventName().endsWith("failed") || event.getType().eventName().endsWith("error")) {
            log.warn("{} {} {}", event.getType().eventName(), event.getSubjectId(), event.getAttributes());
        } else {
            log.info("{} {} {}", event.getType().eventName(), event.getSubjectId(), event.getAttributes());
        }

        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Dropped {} event for {}: {}", event.getType().eventName(), event.getSubjectId(), result);
        }
    }

    public void publish(EventType type, String subjectId, Map<String, Object> attributes) {
        publish(LifecycleEvent.of(type, subjectId, attributes));
    }

    /**
     * Live stream of events published from now on. Each observer is served on its own
     * worker from a bounded buffer; an observer that falls behind misses events and never
     * delays the publisher.
     */
    public Flux<LifecycleEvent> events() {
        return sink.asFlux()
            .onBackpressureDrop(event -> log.debug("Observer lagging, dropped {} event for {}",
                event.getType().eventName(), event.getSubjectId()))
            .publishOn(Schedulers.boundedElastic(), OBSERVER_BUFFER);
    }

    @PreDestroy
    public void shutdown() {
        synchronized (sink) {
            sink.tryEmitComplete();
        }
    }
}
