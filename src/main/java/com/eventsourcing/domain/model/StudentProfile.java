package com.eventsourcing.domain.model;

import com.eventsourcing.domain.error.ValidationError.CourseError;
import com.eventsourcing.domain.error.ValidationError.ProfileError;

import java.time.LocalDate;
import java.util.regex.Pattern;

/**
 * Validated name and email carried by creation and update events.
 */
public record StudentProfile(String fullName, String email) {

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public static Result<StudentProfile, ProfileError> create(String fullName, String email) {
        if (fullName == null || fullName.isBlank()) {
            return Result.failure(ProfileError.BlankName.INSTANCE);
        }
        String trimmedEmail = email == null ? "" : email.trim();
        if (!EMAIL.matcher(trimmedEmail).matches()) {
            return Result.failure(new ProfileError.InvalidEmail(email));
        }
        return Result.success(new StudentProfile(fullName.trim(), trimmedEmail));
    }

    public static Result<LocalDate, ProfileError> checkDateOfBirth(LocalDate dateOfBirth, LocalDate today) {
        if (dateOfBirth == null) {
            return Result.failure(ProfileError.MissingDateOfBirth.INSTANCE);
        }
        if (dateOfBirth.isAfter(today)) {
            return Result.failure(new ProfileError.DateOfBirthInFuture(dateOfBirth));
        }
        return Result.success(dateOfBirth);
    }

    public static Result<String, CourseError> checkCourseName(String courseName) {
        if (courseName == null || courseName.isBlank()) {
            return Result.failure(CourseError.BlankCourseName.INSTANCE);
        }
        return Result.success(courseName.trim());
    }
}
