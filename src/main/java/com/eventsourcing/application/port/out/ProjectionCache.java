package com.eventsourcing.application.port.out;

import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;

import java.util.Optional;

/**
 * Latest materialized state per stream, kept next to the store so reads skip the backend.
 * Entries are replaced whole, never patched.
 */
public interface ProjectionCache {

    Optional<Student> get(StudentId streamId);

    /**
     * Replaces the cached entry unless the cached one has a higher version.
     */
    void put(StudentId streamId, Student student);

    void evict(StudentId streamId);

    void clear();
}
