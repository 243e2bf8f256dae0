package com.eventsourcing.adapter.out.cache;

import com.eventsourcing.application.port.out.ProjectionCache;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap cache of projections. Stores and hands out copies so callers can never mutate a cached entry.
 */
@Component
@ConditionalOnProperty(prefix = "app.projection-cache", name = "type", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryProjectionCache implements ProjectionCache {

    private final Map<StudentId, Student> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<Student> get(StudentId streamId) {
        return Optional.ofNullable(entries.get(streamId)).map(Student::copy);
    }

    @Override
    public void put(StudentId streamId, Student student) {
        Student snapshot = student.copy();
        entries.merge(streamId, snapshot,
            (cached, incoming) -> cached.version() > incoming.version() ? cached : incoming);
    }

    @Override
    public void evict(StudentId streamId) {
        entries.remove(streamId);
    }

    @Override
    public void clear() {
        entries.clear();
    }
}
