package com.eventsourcing.infrastructure.metrics;

import com.eventsourcing.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

@Component
public class AppMetrics implements MetricsPort {

    private final MeterRegistry registry;

    private final Counter appendConflicts;
    private final Counter replays;
    private final Counter unknownEventsSkipped;
    private final Timer appendDuration;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.appendConflicts = Counter.builder("append_conflicts_total")
            .description("Appends rejected because the stream moved on since the projection was read")
            .register(registry);

        this.replays = Counter.builder("aggregate_replays_total")
            .description("Full stream replays served")
            .register(registry);

        this.unknownEventsSkipped = Counter.builder("unknown_events_skipped_total")
            .description("Events of unknown type skipped while folding")
            .register(registry);

        this.appendDuration = Timer.builder("append_duration_seconds")
            .description("Time taken to append an event, retries included")
            .register(registry);
    }

    @Override
    public void incrementEventsAppended(String eventType) {
        Counter.builder("events_appended_total")
            .description("Events durably appended")
            .tag("type", eventType)
            .register(registry)
            .increment();
    }

    @Override
    public void incrementAppendConflicts() {
        appendConflicts.increment();
    }

    @Override
    public void incrementReplays() {
        replays.increment();
    }

    @Override
    public void incrementUnknownEventsSkipped() {
        unknownEventsSkipped.increment();
    }

    @Override
    public <T> T recordAppendDuration(Supplier<T> operation) {
        return appendDuration.record(operation);
    }
}
