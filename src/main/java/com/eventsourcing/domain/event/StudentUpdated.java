package com.eventsourcing.domain.event;

import com.eventsourcing.domain.model.StudentId;

import java.time.Instant;
import java.util.Objects;

public record StudentUpdated(
    StudentId studentId,
    String fullName,
    String email,
    Instant createdAt
) implements StudentEvent {

    public static final String TYPE = "StudentUpdated";

    public StudentUpdated {
        Objects.requireNonNull(studentId, "studentId");
    }

    public static StudentUpdated of(StudentId studentId, String fullName, String email) {
        return new StudentUpdated(studentId, fullName, email, null);
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
    public StudentUpdated withCreatedAt(Instant createdAt) {
        return new StudentUpdated(studentId, fullName, email, createdAt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUpdated(this);
    }
}
