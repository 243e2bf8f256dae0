package com.eventsourcing.domain.event;

import com.eventsourcing.domain.model.StudentId;

import java.time.Instant;

/**
 * An immutable fact about a Student aggregate.
 * <p>
 * {@code createdAt} is null on events built by application code; the event store stamps it
 * at append time through {@link #withCreatedAt(Instant)}.
 */
public sealed interface StudentEvent
        permits StudentCreated, StudentUpdated, StudentEnrolled, StudentUnenrolled, UnrecognizedEvent {

    StudentId streamId();

    Instant createdAt();

    String eventType();

    StudentEvent withCreatedAt(Instant createdAt);

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive dispatch over the event variants. Adding a variant breaks every visitor at compile time.
     */
    interface Visitor<R> {

        R visitCreated(StudentCreated event);

        R visitUpdated(StudentUpdated event);

        R visitEnrolled(StudentEnrolled event);

        R visitUnenrolled(StudentUnenrolled event);

        R visitUnrecognized(UnrecognizedEvent event);
    }
}
