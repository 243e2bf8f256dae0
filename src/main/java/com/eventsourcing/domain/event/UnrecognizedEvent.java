package com.eventsourcing.domain.event;

import com.eventsourcing.domain.model.StudentId;

import java.time.Instant;
import java.util.Objects;

/**
 * A stored event whose type this build does not know, e.g. written by a newer release.
 * Only ever produced by decoding; the store refuses to append one.
 */
public record UnrecognizedEvent(
    StudentId streamId,
    String eventType,
    String payload,
    Instant createdAt
) implements StudentEvent {

    public UnrecognizedEvent {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(eventType, "eventType");
    }

    @Override
    public UnrecognizedEvent withCreatedAt(Instant createdAt) {
        return new UnrecognizedEvent(streamId, eventType, payload, createdAt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnrecognized(this);
    }
}
