package com.eventsourcing.domain.model;

import com.eventsourcing.domain.event.StudentCreated;
import com.eventsourcing.domain.event.StudentEnrolled;
import com.eventsourcing.domain.event.StudentEvent;
import com.eventsourcing.domain.event.StudentUnenrolled;
import com.eventsourcing.domain.event.StudentUpdated;
import com.eventsourcing.domain.event.UnrecognizedEvent;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Current state of a Student, derived by folding its event stream in order.
 * <p>
 * Never authoritative: it must always equal the fold of its stream. {@code version} counts the
 * events folded so far and is what the store's conditional projection write checks against.
 * {@code lastEventAt} is the latest timestamp folded so far; new events are never stamped before it.
 */
public final class Student {

    private StudentId id;
    private String fullName;
    private String email;
    private final List<String> enrolledCourses = new ArrayList<>();
    private LocalDate dateOfBirth;
    private long version;
    private Instant lastEventAt;

    private final StudentEvent.Visitor<Void> applier = new Applier();

    private Student() {
    }

    public static Student empty() {
        return new Student();
    }

    /**
     * Rebuilds a state read back from a persisted projection.
     */
    public static Student restore(
            StudentId id,
            String fullName,
            String email,
            Collection<String> enrolledCourses,
            LocalDate dateOfBirth,
            long version) {
        return restore(id, fullName, email, enrolledCourses, dateOfBirth, version, null);
    }

    /**
     * Rebuilds a state read back from a persisted projection, including the latest folded timestamp.
     */
    public static Student restore(
            StudentId id,
            String fullName,
            String email,
            Collection<String> enrolledCourses,
            LocalDate dateOfBirth,
            long version,
            Instant lastEventAt) {
        if (version < 0) {
            throw new IllegalArgumentException("Version cannot be negative, was " + version);
        }
        Student student = new Student();
        student.id = id;
        student.fullName = fullName;
        student.email = email;
        if (enrolledCourses != null) {
            enrolledCourses.stream().distinct().forEach(student.enrolledCourses::add);
        }
        student.dateOfBirth = dateOfBirth;
        student.version = version;
        student.lastEventAt = lastEventAt;
        return student;
    }

    /**
     * Folds one event into this state.
     */
    public void apply(StudentEvent event) {
        event.accept(applier);
        count(event);
    }

    /**
     * Counts an event as folded without letting it change any field.
     */
    public void skip(StudentEvent event) {
        Objects.requireNonNull(event, "event");
        count(event);
    }

    private void count(StudentEvent event) {
        version++;
        Instant createdAt = event.createdAt();
        if (createdAt != null && (lastEventAt == null || createdAt.isAfter(lastEventAt))) {
            lastEventAt = createdAt;
        }
    }

    public Student copy() {
        return restore(id, fullName, email, enrolledCourses, dateOfBirth, version, lastEventAt);
    }

    public boolean isCreated() {
        return id != null;
    }

    public StudentId id() {
        return id;
    }

    public String fullName() {
        return fullName;
    }

    public String email() {
        return email;
    }

    public List<String> enrolledCourses() {
        return List.copyOf(enrolledCourses);
    }

    public LocalDate dateOfBirth() {
        return dateOfBirth;
    }

    public long version() {
        return version;
    }

    public Instant lastEventAt() {
        return lastEventAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Student other)) {
            return false;
        }
        return version == other.version
            && Objects.equals(id, other.id)
            && Objects.equals(fullName, other.fullName)
            && Objects.equals(email, other.email)
            && enrolledCourses.equals(other.enrolledCourses)
            && Objects.equals(dateOfBirth, other.dateOfBirth)
            && Objects.equals(lastEventAt, other.lastEventAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fullName, email, enrolledCourses, dateOfBirth, version, lastEventAt);
    }

    @Override
    public String toString() {
        return "Student{id=" + id
            + ", fullName='" + fullName + '\''
            + ", email='" + email + '\''
            + ", enrolledCourses=" + enrolledCourses
            + ", dateOfBirth=" + dateOfBirth
            + ", version=" + version
            + ", lastEventAt=" + lastEventAt + '}';
    }

    private final class Applier implements StudentEvent.Visitor<Void> {

        @Override
        public Void visitCreated(StudentCreated event) {
            id = event.studentId();
            fullName = event.fullName();
            email = event.email();
            dateOfBirth = event.dateOfBirth();
            return null;
        }

        @Override
        public Void visitUpdated(StudentUpdated event) {
            // date of birth is not part of an update
            fullName = event.fullName();
            email = event.email();
            return null;
        }

        @Override
        public Void visitEnrolled(StudentEnrolled event) {
            if (!enrolledCourses.contains(event.courseName())) {
                enrolledCourses.add(event.courseName());
            }
            return null;
        }

        @Override
        public Void visitUnenrolled(StudentUnenrolled event) {
            enrolledCourses.remove(event.courseName());
            return null;
        }

        @Override
        public Void visitUnrecognized(UnrecognizedEvent event) {
            return null;
        }
    }
}
