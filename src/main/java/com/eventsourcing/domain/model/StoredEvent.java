package com.eventsourcing.domain.model;

import com.eventsourcing.domain.event.StudentEvent;

import java.util.Objects;

/**
 * An event as persisted in its stream. {@code sequence} is the 1-based position the store
 * assigned at append time and breaks ties between identical timestamps.
 */
public record StoredEvent(StudentEvent event, long sequence) {

    public StoredEvent {
        Objects.requireNonNull(event, "event");
        if (event.createdAt() == null) {
            throw new IllegalArgumentException("Stored event must carry a createdAt timestamp");
        }
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence must be positive, was " + sequence);
        }
    }

    public StudentId streamId() {
        return event.streamId();
    }
}
