package com.eventsourcing.domain.error;

import com.eventsourcing.domain.model.StudentId;

/**
 * Expected failures of student commands at the application layer.
 * Validation failures are wrapped; existence is decided by reading the projection.
 */
public sealed interface StudentError {

    record NotFound(StudentId studentId) implements StudentError {
        @Override
        public String message() {
            return "Student not found: " + studentId;
        }

        @Override
        public String code() {
            return "STUDENT_NOT_FOUND";
        }
    }

    record ValidationFailed(ValidationError error) implements StudentError {
        @Override
        public String message() {
            return error.message();
        }

        @Override
        public String code() {
            return error.code();
        }
    }

    String message();

    String code();
}
