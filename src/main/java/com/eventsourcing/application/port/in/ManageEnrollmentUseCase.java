package com.eventsourcing.application.port.in;

import com.eventsourcing.domain.error.StudentError;
import com.eventsourcing.domain.model.Result;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;

public interface ManageEnrollmentUseCase {

    Result<Student, StudentError> enroll(StudentId studentId, String courseName);

    Result<Student, StudentError> unenroll(StudentId studentId, String courseName);
}
