package com.eventsourcing.application.service;

import com.eventsourcing.adapter.out.cache.InMemoryProjectionCache;
import com.eventsourcing.adapter.out.persistence.InMemoryEventBackend;
import com.eventsourcing.adapter.out.persistence.JacksonRecordCodec;
import com.eventsourcing.application.port.out.EventRecord;
import com.eventsourcing.application.port.out.ProjectionRecord;
import com.eventsourcing.application.port.out.RecordKeys;
import com.eventsourcing.domain.event.StudentCreated;
import com.eventsourcing.domain.event.StudentEnrolled;
import com.eventsourcing.domain.event.StudentEvent;
import com.eventsourcing.domain.event.StudentUnenrolled;
import com.eventsourcing.domain.event.StudentUpdated;
import com.eventsourcing.domain.event.UnrecognizedEvent;
import com.eventsourcing.domain.model.DuplicateCreatedPolicy;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;
import com.eventsourcing.domain.model.UnknownEventPolicy;
import com.eventsourcing.infrastructure.config.AppProperties;
import com.eventsourcing.infrastructure.exception.ConcurrentAppendException;
import com.eventsourcing.infrastructure.metrics.AppMetrics;
import com.eventsourcing.support.SteppingClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the event store end to end against the in-process backend and cache.
 */
@DisplayName("Event store on the in-memory backend")
class InMemoryEventStoreTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");
    private static final LocalDate DOB = LocalDate.of(1990, 1, 1);

    private final InMemoryEventBackend backend = new InMemoryEventBackend();
    private final InMemoryProjectionCache cache = new InMemoryProjectionCache();
    private final JacksonRecordCodec codec = new JacksonRecordCodec(new ObjectMapper());
    private final AppMetrics metrics = new AppMetrics(new SimpleMeterRegistry());

    private EventStoreService eventStore(Clock clock, int maxAppendAttempts) {
        AppProperties properties = new AppProperties();
        properties.getEventStore().setMaxAppendAttempts(maxAppendAttempts);
        StudentProjector projector = new StudentProjector(
            UnknownEventPolicy.PERMISSIVE, DuplicateCreatedPolicy.LAST_WRITE_WINS, metrics);
        return new EventStoreService(backend, cache, codec, projector, metrics, clock, properties);
    }

    private EventStoreService eventStore() {
        return eventStore(new SteppingClock(START, Duration.ofMillis(1)), 3);
    }

    @Nested
    @DisplayName("registration journey")
    class Journey {

        @Test
        @DisplayName("Created, enrolled and updated student replays to the latest profile")
        void johnDoeJourney() {
            EventStoreService store = eventStore();
            StudentId s1 = StudentId.random();

            store.append(StudentCreated.of(s1, "John Doe", "john@x.com", DOB));
            store.append(StudentEnrolled.of(s1, "REST APIs 101"));
            store.append(StudentUpdated.of(s1, "John Doe", "john2@x.com"));

            Student aggregate = store.getAggregate(s1).orElseThrow();
            assertEquals(s1, aggregate.id());
            assertEquals("John Doe", aggregate.fullName());
            assertEquals("john2@x.com", aggregate.email());
            assertEquals(DOB, aggregate.dateOfBirth());
            assertEquals(List.of("REST APIs 101"), aggregate.enrolledCourses());
            assertEquals(3L, aggregate.version());

            assertEquals(Optional.of(aggregate), store.getProjection(s1));
            assertTrue(store.isProjectionConsistent(s1));
        }

        @Test
        @DisplayName("Unknown student is absent on both read paths")
        void unknownStudentIsAbsent() {
            EventStoreService store = eventStore();
            StudentId unknown = StudentId.random();

            assertTrue(store.getAggregate(unknown).isEmpty());
            assertTrue(store.getProjection(unknown).isEmpty());
            assertTrue(store.getHistory(unknown).isEmpty());
            assertTrue(store.isProjectionConsistent(unknown));
        }

        @Test
        @DisplayName("History lists the events with their assigned timestamps")
        void historyCarriesTimestamps() {
            EventStoreService store = eventStore();
            StudentId s1 = StudentId.random();

            store.append(StudentCreated.of(s1, "John Doe", "john@x.com", DOB));
            store.append(StudentEnrolled.of(s1, "Java"));

            List<StudentEvent> history = store.getHistory(s1);
            assertEquals(2, history.size());
            assertInstanceOf(StudentCreated.class, history.get(0));
            assertInstanceOf(StudentEnrolled.class, history.get(1));
            assertNotNull(history.get(0).createdAt());
            assertTrue(history.get(0).createdAt().isBefore(history.get(1).createdAt()));
        }
    }

    @Test
    @DisplayName("Projection and replay agree after a long random sequence of appends")
    void projectionMatchesReplay() {
        EventStoreService store = eventStore();
        StudentId id = StudentId.random();
        Random random = new Random(42);
        List<String> courses = List.of("Java", "Kotlin", "Scala", "Groovy");

        store.append(StudentCreated.of(id, "John Doe", "john@x.com", DOB));
        for (int i = 0; i < 200; i++) {
            String course = courses.get(random.nextInt(courses.size()));
            switch (random.nextInt(3)) {
                case 0 -> store.append(StudentEnrolled.of(id, course));
                case 1 -> store.append(StudentUnenrolled.of(id, course));
                default -> store.append(StudentUpdated.of(id, "Name " + i, "n" + i + "@x.com"));
            }
        }

        cache.clear();
        assertEquals(store.getAggregate(id), store.getProjection(id));
        assertEquals(201L, store.getProjection(id).orElseThrow().version());
    }

    @Test
    @DisplayName("Events sharing a timestamp replay in append order")
    void identicalTimestampsKeepAppendOrder() {
        EventStoreService store = eventStore(SteppingClock.frozenAt(START), 3);
        StudentId id = StudentId.random();

        store.append(StudentCreated.of(id, "John Doe", "john@x.com", DOB));
        store.append(StudentEnrolled.of(id, "Java"));
        store.append(StudentUnenrolled.of(id, "Java"));
        store.append(StudentEnrolled.of(id, "Kotlin"));

        Student aggregate = store.getAggregate(id).orElseThrow();
        assertEquals(List.of("Kotlin"), aggregate.enrolledCourses());
        assertTrue(store.isProjectionConsistent(id));
    }

    @Nested
    @DisplayName("clock stepping backwards")
    class ClockStepBack {

        @Test
        @DisplayName("Replay folds in the same order as the projection")
        void replayMatchesProjection() {
            EventStoreService store = eventStore(new SteppingClock(START, Duration.ofSeconds(-1)), 3);
            StudentId id = StudentId.random();

            store.append(StudentCreated.of(id, "John Doe", "john@x.com", DOB));
            store.append(StudentUpdated.of(id, "X", "x@x.com"));
            store.append(StudentEnrolled.of(id, "Java"));

            Student projection = store.getProjection(id).orElseThrow();
            Student aggregate = store.getAggregate(id).orElseThrow();
            assertEquals("X", aggregate.fullName());
            assertEquals("x@x.com", aggregate.email());
            assertEquals(projection, aggregate);
            assertTrue(store.isProjectionConsistent(id));
        }

        @Test
        @DisplayName("Later events are held at the last stamped time")
        void laterEventsNeverPrecedeEarlierOnes() {
            EventStoreService store = eventStore(new SteppingClock(START, Duration.ofMillis(-250)), 3);
            StudentId id = StudentId.random();

            store.append(StudentCreated.of(id, "John Doe", "john@x.com", DOB));
            store.append(StudentEnrolled.of(id, "Java"));
            store.append(StudentUnenrolled.of(id, "Java"));

            List<StudentEvent> history = store.getHistory(id);
            assertInstanceOf(StudentCreated.class, history.get(0));
            assertInstanceOf(StudentEnrolled.class, history.get(1));
            assertInstanceOf(StudentUnenrolled.class, history.get(2));
            history.forEach(event -> assertEquals(START, event.createdAt()));
            assertEquals(START, store.getProjection(id).orElseThrow().lastEventAt());
        }

        @Test
        @DisplayName("Time resumes once the clock catches up")
        void clockCatchesUp() {
            SteppingClock clock = new SteppingClock(START, Duration.ofSeconds(-1));
            EventStoreService store = eventStore(clock, 3);
            StudentId id = StudentId.random();
            store.append(StudentCreated.of(id, "John Doe", "john@x.com", DOB));

            EventStoreService recovered = eventStore(new SteppingClock(START.plusSeconds(5), Duration.ZERO), 3);
            recovered.append(StudentEnrolled.of(id, "Java"));

            assertEquals(START.plusSeconds(5), recovered.getHistory(id).get(1).createdAt());
            assertTrue(recovered.isProjectionConsistent(id));
        }
    }

    @Test
    @DisplayName("A stored event of unknown type is skipped on replay")
    void unknownStoredEventIsSkipped() {
        EventStoreService store = eventStore();
        StudentId id = StudentId.random();
        Student created = store.append(StudentCreated.of(id, "John Doe", "john@x.com", DOB));

        // a newer release wrote an event this build does not know
        Instant graduatedAt = START.plusSeconds(60);
        Student afterUnknown = created.copy();
        afterUnknown.apply(new UnrecognizedEvent(id, "StudentGraduated", "{}", graduatedAt));
        backend.putDurablePair(
            new EventRecord(RecordKeys.eventPartitionKey(id), RecordKeys.sortKey(graduatedAt), 2,
                "StudentGraduated", "{\"year\":2024}"),
            codec.encodeProjection(id, afterUnknown),
            1L);
        cache.clear();

        List<StudentEvent> history = store.getHistory(id);
        assertInstanceOf(UnrecognizedEvent.class, history.get(1));
        assertEquals("StudentGraduated", history.get(1).eventType());

        Student aggregate = store.getAggregate(id).orElseThrow();
        assertEquals("John Doe", aggregate.fullName());
        assertEquals(2L, aggregate.version());
        assertTrue(store.isProjectionConsistent(id));
    }

    @Test
    @DisplayName("Concurrent appends to one stream all land exactly once")
    void concurrentAppendsAreSerialized() throws Exception {
        EventStoreService store = eventStore(new SteppingClock(START, Duration.ofNanos(1500)), 1_000);
        StudentId id = StudentId.random();
        store.append(StudentCreated.of(id, "John Doe", "john@x.com", DOB));

        int threads = 4;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    store.append(StudentEnrolled.of(id, "course-" + thread + "-" + i));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        Student projection = store.getProjection(id).orElseThrow();
        assertEquals(1L + threads * perThread, projection.version());
        assertEquals(threads * perThread, projection.enrolledCourses().size());
        assertEquals(threads * perThread + 1, store.getHistory(id).size());
        assertTrue(store.isProjectionConsistent(id));
    }

    @Test
    @DisplayName("A conflicting pair write stores neither record")
    void conflictingPairWriteStoresNothing() {
        EventStoreService store = eventStore();
        StudentId id = StudentId.random();
        store.append(StudentCreated.of(id, "John Doe", "john@x.com", DOB));
        ProjectionRecord before = backend.getProjectionRecord(id).orElseThrow();

        Student stale = Student.restore(id, "Stale", "stale@x.com", List.of(), DOB, 2);
        EventRecord event = new EventRecord(RecordKeys.eventPartitionKey(id), RecordKeys.sortKey(START), 2,
            StudentUpdated.TYPE, "{}");

        assertThrows(ConcurrentAppendException.class,
            () -> backend.putDurablePair(event, codec.encodeProjection(id, stale), 0L));
        assertEquals(1, backend.getStreamRecords(id).size());
        assertEquals(before, backend.getProjectionRecord(id).orElseThrow());
    }
}
