package com.eventsourcing.application.port.out;

import com.eventsourcing.domain.model.StoredEvent;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;

/**
 * Converts events and projections to backend records and back.
 * Decoding failures surface as {@link com.eventsourcing.infrastructure.exception.MalformedRecordException}.
 */
public interface RecordCodec {

    EventRecord encodeEvent(StoredEvent stored);

    /**
     * Unknown event types decode to an {@link com.eventsourcing.domain.event.UnrecognizedEvent}.
     */
    StoredEvent decodeEvent(EventRecord record);

    ProjectionRecord encodeProjection(StudentId streamId, Student student);

    Student decodeProjection(ProjectionRecord record);
}
