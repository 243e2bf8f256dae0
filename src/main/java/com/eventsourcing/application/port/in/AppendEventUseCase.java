package com.eventsourcing.application.port.in;

import com.eventsourcing.domain.event.StudentEvent;
import com.eventsourcing.domain.model.Student;

public interface AppendEventUseCase {

    /**
     * Stamps, stores and folds one event, returning the stream's new state.
     */
    Student append(StudentEvent event);
}
