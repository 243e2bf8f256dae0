package com.eventsourcing.domain.event;

import com.eventsourcing.domain.model.StudentId;

import java.time.Instant;
import java.util.Objects;

public record StudentEnrolled(
    StudentId studentId,
    String courseName,
    Instant createdAt
) implements StudentEvent {

    public static final String TYPE = "StudentEnrolled";

    public StudentEnrolled {
        Objects.requireNonNull(studentId, "studentId");
    }

    public static StudentEnrolled of(StudentId studentId, String courseName) {
        return new StudentEnrolled(studentId, courseName, null);
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
    public StudentEnrolled withCreatedAt(Instant createdAt) {
        return new StudentEnrolled(studentId, courseName, createdAt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitEnrolled(this);
    }
}
