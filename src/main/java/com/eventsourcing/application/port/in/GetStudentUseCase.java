package com.eventsourcing.application.port.in;

import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;

import java.util.Optional;

public interface GetStudentUseCase {

    /**
     * Rebuilds the state by replaying the whole stream. Empty if the stream has no events.
     */
    Optional<Student> getAggregate(StudentId studentId);

    /**
     * Returns the materialized projection without replaying.
     */
    Optional<Student> getProjection(StudentId studentId);
}
