package com.eventsourcing.infrastructure.exception;

import com.eventsourcing.domain.model.StudentId;

public class DuplicateCreationException extends EventStoreException {

    public DuplicateCreationException(StudentId streamId) {
        super("DUPLICATE_CREATION", "Student " + streamId + " has already been created");
    }
}
