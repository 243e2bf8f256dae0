package com.eventsourcing.infrastructure.exception;

import com.eventsourcing.domain.model.StudentId;

public class UnknownEventTypeException extends EventStoreException {

    public UnknownEventTypeException(StudentId streamId, String eventType) {
        super("UNKNOWN_EVENT_TYPE", "Stream " + streamId + " holds unknown event type '" + eventType + "'");
    }
}
