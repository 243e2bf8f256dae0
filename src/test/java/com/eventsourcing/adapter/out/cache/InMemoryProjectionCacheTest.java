package com.eventsourcing.adapter.out.cache;

import com.eventsourcing.domain.event.StudentEnrolled;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryProjectionCacheTest {

    private static final StudentId ID = StudentId.random();

    private final InMemoryProjectionCache cache = new InMemoryProjectionCache();

    private static Student student(long version, String... courses) {
        return Student.restore(ID, "John Doe", "john@x.com", List.of(courses), LocalDate.of(1990, 1, 1), version);
    }

    @Test
    void shouldReturnStoredEntry() {
        cache.put(ID, student(1));

        assertEquals(student(1), cache.get(ID).orElseThrow());
    }

    @Test
    void shouldNotReplaceNewerEntryWithOlderOne() {
        cache.put(ID, student(3, "Java"));
        cache.put(ID, student(2));

        assertEquals(3L, cache.get(ID).orElseThrow().version());
    }

    @Test
    void shouldOverwriteWithNewerEntry() {
        cache.put(ID, student(1));
        cache.put(ID, student(2, "Java"));

        assertEquals(List.of("Java"), cache.get(ID).orElseThrow().enrolledCourses());
    }

    @Test
    void shouldIsolateEntriesFromCallerMutation() {
        Student original = student(1);
        cache.put(ID, original);
        original.apply(StudentEnrolled.of(ID, "Java"));

        Student cached = cache.get(ID).orElseThrow();
        cached.apply(StudentEnrolled.of(ID, "Kotlin"));

        assertEquals(1L, cache.get(ID).orElseThrow().version());
        assertTrue(cache.get(ID).orElseThrow().enrolledCourses().isEmpty());
    }

    @Test
    void evictAndClearShouldRemoveEntries() {
        StudentId other = StudentId.random();
        cache.put(ID, student(1));
        cache.put(other, student(1));

        cache.evict(ID);
        assertTrue(cache.get(ID).isEmpty());
        assertTrue(cache.get(other).isPresent());

        cache.clear();
        assertTrue(cache.get(other).isEmpty());
    }
}
