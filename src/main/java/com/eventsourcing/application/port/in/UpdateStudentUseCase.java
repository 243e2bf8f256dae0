package com.eventsourcing.application.port.in;

import com.eventsourcing.domain.error.StudentError;
import com.eventsourcing.domain.model.Result;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;

public interface UpdateStudentUseCase {
    Result<Student, StudentError> updateStudent(StudentId studentId, String fullName, String email);
}
