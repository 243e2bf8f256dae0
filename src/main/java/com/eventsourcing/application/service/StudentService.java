package com.eventsourcing.application.service;

import com.eventsourcing.application.port.in.AppendEventUseCase;
import com.eventsourcing.application.port.in.GetStudentUseCase;
import com.eventsourcing.application.port.in.ManageEnrollmentUseCase;
import com.eventsourcing.application.port.in.RegisterStudentUseCase;
import com.eventsourcing.application.port.in.UpdateStudentUseCase;
import com.eventsourcing.application.port.out.IdGenerator;
import com.eventsourcing.domain.error.StudentError;
import com.eventsourcing.domain.event.StudentCreated;
import com.eventsourcing.domain.event.StudentEnrolled;
import com.eventsourcing.domain.event.StudentEvent;
import com.eventsourcing.domain.event.StudentUnenrolled;
import com.eventsourcing.domain.event.StudentUpdated;
import com.eventsourcing.domain.model.Result;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;
import com.eventsourcing.domain.model.StudentProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Student commands. Each one validates its input, turns it into a single event and appends it;
 * state is never written directly.
 */
@Service
public class StudentService implements RegisterStudentUseCase, UpdateStudentUseCase, ManageEnrollmentUseCase {

    private static final Logger log = LoggerFactory.getLogger(StudentService.class);

    private final AppendEventUseCase eventStore;
    private final GetStudentUseCase students;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public StudentService(
            AppendEventUseCase eventStore,
            GetStudentUseCase students,
            IdGenerator idGenerator,
            Clock clock) {
        this.eventStore = eventStore;
        this.students = students;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Override
    public Result<Student, StudentError> registerStudent(String fullName, String email, LocalDate dateOfBirth) {
        log.debug("Registering student: email={}", email);

        var profileResult = StudentProfile.create(fullName, email);
        if (profileResult.isFailure()) {
            log.warn("Student validation failed: {}", profileResult.errorOrNull().message());
            return Result.failure(new StudentError.ValidationFailed(profileResult.errorOrNull()));
        }
        var dobResult = StudentProfile.checkDateOfBirth(dateOfBirth, LocalDate.now(clock));
        if (dobResult.isFailure()) {
            log.warn("Student validation failed: {}", dobResult.errorOrNull().message());
            return Result.failure(new StudentError.ValidationFailed(dobResult.errorOrNull()));
        }

        StudentProfile profile = profileResult.getOrThrow();
        StudentId studentId = StudentId.of(idGenerator.generate());
        Student student = eventStore.append(
            StudentCreated.of(studentId, profile.fullName(), profile.email(), dobResult.getOrThrow()));

        log.info("Student registered: studentId={}", studentId);
        return Result.success(student);
    }

    @Override
    public Result<Student, StudentError> updateStudent(StudentId studentId, String fullName, String email) {
        log.debug("Updating student={}", studentId);

        var profileResult = StudentProfile.create(fullName, email);
        if (profileResult.isFailure()) {
            log.warn("Update validation failed for student={}: {}", studentId, profileResult.errorOrNull().message());
            return Result.failure(new StudentError.ValidationFailed(profileResult.errorOrNull()));
        }
        StudentProfile profile = profileResult.getOrThrow();
        return appendToExisting(studentId, StudentUpdated.of(studentId, profile.fullName(), profile.email()));
    }

    @Override
    public Result<Student, StudentError> enroll(StudentId studentId, String courseName) {
        return StudentProfile.checkCourseName(courseName).fold(
            course -> appendToExisting(studentId, StudentEnrolled.of(studentId, course)),
            error -> Result.failure(new StudentError.ValidationFailed(error)));
    }

    @Override
    public Result<Student, StudentError> unenroll(StudentId studentId, String courseName) {
        return StudentProfile.checkCourseName(courseName).fold(
            course -> appendToExisting(studentId, StudentUnenrolled.of(studentId, course)),
            error -> Result.failure(new StudentError.ValidationFailed(error)));
    }

    private Result<Student, StudentError> appendToExisting(StudentId studentId, StudentEvent event) {
        if (students.getProjection(studentId).isEmpty()) {
            log.debug("Student not found: {}", studentId);
            return Result.failure(new StudentError.NotFound(studentId));
        }
        Student student = eventStore.append(event);
        log.info("{} applied to student={}", event.eventType(), studentId);
        return Result.success(student);
    }
}
