package com.eventsourcing.domain.event;

import com.eventsourcing.domain.model.StudentId;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

public record StudentCreated(
    StudentId studentId,
    String fullName,
    String email,
    LocalDate dateOfBirth,
    Instant createdAt
) implements StudentEvent {

    public static final String TYPE = "StudentCreated";

    public StudentCreated {
        Objects.requireNonNull(studentId, "studentId");
    }

    public static StudentCreated of(StudentId studentId, String fullName, String email, LocalDate dateOfBirth) {
        return new StudentCreated(studentId, fullName, email, dateOfBirth, null);
    }

    @Override
    public StudentId streamId() {
        return studentId;
    }

    @Override
    public String eventType() {
        return TYPE;
    }

    @Override
    public StudentCreated withCreatedAt(Instant createdAt) {
        return new StudentCreated(studentId, fullName, email, dateOfBirth, createdAt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitCreated(this);
    }
}
