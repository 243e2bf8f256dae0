package com.eventsourcing.domain.event;

import com.eventsourcing.domain.model.StudentId;

import java.time.Instant;
import java.util.Objects;

public record StudentUnenrolled(
    StudentId studentId,
    String courseName,
    Instant createdAt
) implements StudentEvent {

    // Stored wire name predates the Java naming
    public static final String TYPE = "StudentUnEnrolled";

    public StudentUnenrolled {
        Objects.requireNonNull(studentId, "studentId");
    }

    public static StudentUnenrolled of(StudentId studentId, String courseName) {
        return new StudentUnenrolled(studentId, courseName, null);
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
    public StudentUnenrolled withCreatedAt(Instant createdAt) {
        return new StudentUnenrolled(studentId, courseName, createdAt);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnenrolled(this);
    }
}
