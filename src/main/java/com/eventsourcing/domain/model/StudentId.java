package com.eventsourcing.domain.model;

import com.eventsourcing.domain.error.ValidationError.StudentIdError;

import java.util.UUID;

/**
 * Identity of a Student aggregate and of its event stream.
 */
public record StudentId(UUID value) {

    public StudentId {
        if (value == null) {
            throw new IllegalStateException("StudentId value cannot be null - use parse() for validation");
        }
    }

    /**
     * Parses external input, returning a Result for expected validation failures.
     */
    public static Result<StudentId, StudentIdError> parse(String value) {
        if (value == null || value.isBlank()) {
            return Result.failure(StudentIdError.Empty.INSTANCE);
        }
        try {
            return Result.success(new StudentId(UUID.fromString(value.trim())));
        } catch (IllegalArgumentException e) {
            return Result.failure(new StudentIdError.InvalidFormat(value));
        }
    }

    public static StudentId of(UUID value) {
        return new StudentId(value);
    }

    /**
     * Rebuilds an id read back from the store. A value that is not a UUID means the record is corrupted.
     *
     * @throws IllegalStateException if the value is not a valid UUID
     */
    public static StudentId fromTrusted(String value) {
        try {
            return new StudentId(UUID.fromString(value));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalStateException("Corrupted StudentId in stored record: " + value, e);
        }
    }

    public static StudentId random() {
        return new StudentId(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
