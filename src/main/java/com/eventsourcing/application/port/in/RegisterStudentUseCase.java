package com.eventsourcing.application.port.in;

import com.eventsourcing.domain.error.StudentError;
import com.eventsourcing.domain.model.Result;
import com.eventsourcing.domain.model.Student;

import java.time.LocalDate;

public interface RegisterStudentUseCase {
    Result<Student, StudentError> registerStudent(String fullName, String email, LocalDate dateOfBirth);
}
