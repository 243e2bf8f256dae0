package com.eventsourcing.application.port.out;

import java.util.function.Supplier;

/**
 * Port for recording event store metrics.
 */
public interface MetricsPort {

    void incrementEventsAppended(String eventType);

    void incrementAppendConflicts();

    void incrementReplays();

    void incrementUnknownEventsSkipped();

    <T> T recordAppendDuration(Supplier<T> operation);
}
