package com.eventsourcing.application.port.in;

import com.eventsourcing.domain.event.StudentEvent;
import com.eventsourcing.domain.model.StudentId;

import java.util.List;

public interface GetStudentHistoryUseCase {

    List<StudentEvent> getHistory(StudentId studentId);

    /**
     * True when the projection equals the replayed state, including when neither exists.
     */
    boolean isProjectionConsistent(StudentId studentId);
}
