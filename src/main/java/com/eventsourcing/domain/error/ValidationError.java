package com.eventsourcing.domain.error;

import java.time.LocalDate;

/**
 * Sealed type representing domain validation errors.
 * These are expected business outcomes, not exceptional cases.
 */
public sealed interface ValidationError {

    String message();

    String code();

    sealed interface StudentIdError extends ValidationError {

        record Empty() implements StudentIdError {
            public static final Empty INSTANCE = new Empty();

            @Override
            public String message() {
                return "Student ID cannot be empty";
            }

            @Override
            public String code() {
                return "STUDENT_ID_EMPTY";
            }
        }

        record InvalidFormat(String value) implements StudentIdError {
            @Override
            public String message() {
                return "Student ID must be a valid UUID format: " + value;
            }

            @Override
            public String code() {
                return "STUDENT_ID_INVALID_FORMAT";
            }
        }
    }

    sealed interface ProfileError extends ValidationError {

        record BlankName() implements ProfileError {
            public static final BlankName INSTANCE = new BlankName();

            @Override
            public String message() {
                return "Full name cannot be empty";
            }

            @Override
            public String code() {
                return "FULL_NAME_EMPTY";
            }
        }

        record InvalidEmail(String value) implements ProfileError {
            @Override
            public String message() {
                return "Email is not a valid address: " + value;
            }

            @Override
            public String code() {
                return "EMAIL_INVALID";
            }
        }

        record MissingDateOfBirth() implements ProfileError {
            public static final MissingDateOfBirth INSTANCE = new MissingDateOfBirth();

            @Override
            public String message() {
                return "Date of birth is required";
            }

            @Override
            public String code() {
                return "DATE_OF_BIRTH_MISSING";
            }
        }

        record DateOfBirthInFuture(LocalDate dateOfBirth) implements ProfileError {
            @Override
            public String message() {
                return "Date of birth cannot be in the future: " + dateOfBirth;
            }

            @Override
            public String code() {
                return "DATE_OF_BIRTH_IN_FUTURE";
            }
        }
    }

    sealed interface CourseError extends ValidationError {

        record BlankCourseName() implements CourseError {
            public static final BlankCourseName INSTANCE = new BlankCourseName();

            @Override
            public String message() {
                return "Course name cannot be empty";
            }

            @Override
            public String code() {
                return "COURSE_NAME_EMPTY";
            }
        }
    }
}
