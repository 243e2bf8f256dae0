package com.eventsourcing.application.port.out;

import com.eventsourcing.domain.model.StudentId;

import java.util.List;
import java.util.Optional;

/**
 * Storage boundary of the event store. Implementations own connectivity and persistence;
 * the store only ever sees records.
 * <p>
 * Implementations translate their own failures into
 * {@link com.eventsourcing.infrastructure.exception.BackendUnavailableException} and
 * {@link com.eventsourcing.infrastructure.exception.ConcurrentAppendException}.
 */
public interface EventBackend {

    /**
     * Writes the event and the updated projection as one unit: both are stored or neither is.
     * The projection is only written if the stored one is still at {@code expectedVersion}
     * (0 meaning no projection exists yet).
     */
    void putDurablePair(EventRecord event, ProjectionRecord projection, long expectedVersion);

    Optional<ProjectionRecord> getProjectionRecord(StudentId streamId);

    /**
     * All event records of the stream, ascending by sort key then sequence. Empty if the stream does not exist.
     */
    List<EventRecord> getStreamRecords(StudentId streamId);
}
