package com.eventsourcing.application.service;

import com.eventsourcing.application.port.in.AppendEventUseCase;
import com.eventsourcing.application.port.in.GetStudentHistoryUseCase;
import com.eventsourcing.application.port.in.GetStudentUseCase;
import com.eventsourcing.application.port.out.EventBackend;
import com.eventsourcing.application.port.out.EventRecord;
import com.eventsourcing.application.port.out.MetricsPort;
import com.eventsourcing.application.port.out.ProjectionCache;
import com.eventsourcing.application.port.out.ProjectionRecord;
import com.eventsourcing.application.port.out.RecordCodec;
import com.eventsourcing.domain.event.StudentEvent;
import com.eventsourcing.domain.event.UnrecognizedEvent;
import com.eventsourcing.domain.model.EventStream;
import com.eventsourcing.domain.model.StoredEvent;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;
import com.eventsourcing.infrastructure.config.AppProperties;
import com.eventsourcing.infrastructure.exception.BackendUnavailableException;
import com.eventsourcing.infrastructure.exception.ConcurrentAppendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * The event store: appends events with a synchronous fold into the projection, and reads
 * state either from the projection (fast path) or by replaying the stream (audit path).
 * <p>
 * Appends are read-fold-write cycles guarded by the projection version: the backend rejects
 * the write if another append landed in between, and the cycle is re-run from a fresh read.
 * The cache is only touched after the backend has committed.
 */
@Service
public class EventStoreService implements AppendEventUseCase, GetStudentUseCase, GetStudentHistoryUseCase {

    private static final Logger log = LoggerFactory.getLogger(EventStoreService.class);

    private final EventBackend backend;
    private final ProjectionCache projectionCache;
    private final RecordCodec codec;
    private final StudentProjector projector;
    private final MetricsPort metrics;
    private final Clock clock;
    private final int maxAppendAttempts;

    public EventStoreService(
            EventBackend backend,
            ProjectionCache projectionCache,
            RecordCodec codec,
            StudentProjector projector,
            MetricsPort metrics,
            Clock clock,
            AppProperties appProperties) {
        this.backend = backend;
        this.projectionCache = projectionCache;
        this.codec = codec;
        this.projector = projector;
        this.metrics = metrics;
        this.clock = clock;
        this.maxAppendAttempts = Math.max(1, appProperties.getEventStore().getMaxAppendAttempts());
    }

    @Override
    public Student append(StudentEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        if (event instanceof UnrecognizedEvent unknown) {
            throw new IllegalArgumentException("Cannot append event of unknown type '" + unknown.eventType() + "'");
        }
        return metrics.recordAppendDuration(() -> appendWithRetry(event));
    }

    private Student appendWithRetry(StudentEvent event) {
        for (int attempt = 1; ; attempt++) {
            try {
                return appendOnce(event);
            } catch (ConcurrentAppendException e) {
                metrics.incrementAppendConflicts();
                if (attempt >= maxAppendAttempts) {
                    log.warn("Giving up append on stream={} after {} conflicting attempts", event.streamId(), attempt);
                    throw e;
                }
                log.warn("Concurrent append on stream={}, retrying (attempt {}/{})",
                    event.streamId(), attempt, maxAppendAttempts);
            }
        }
    }

    private Student appendOnce(StudentEvent event) {
        StudentId streamId = event.streamId();
        Student state = backend.getProjectionRecord(streamId)
            .map(codec::decodeProjection)
            .orElseGet(Student::empty);
        long expectedVersion = state.version();

        StudentEvent stamped = event.withCreatedAt(stampAfter(state.lastEventAt()));
        log.debug("Appending {} to stream={} at version={}", stamped.eventType(), streamId, expectedVersion);

        projector.project(state, stamped);

        EventRecord eventRecord = codec.encodeEvent(new StoredEvent(stamped, expectedVersion + 1));
        ProjectionRecord projectionRecord = codec.encodeProjection(streamId, state);
        backend.putDurablePair(eventRecord, projectionRecord, expectedVersion);
        log.debug("Event and projection stored: stream={}, sortKey={}", streamId, eventRecord.sortKey());

        refreshCache(streamId, state);
        metrics.incrementEventsAppended(stamped.eventType());
        log.info("Appended {} to stream={}, version={}", stamped.eventType(), streamId, state.version());
        return state.copy();
    }

    @Override
    public Optional<Student> getAggregate(StudentId studentId) {
        EventStream stream = loadStream(studentId);
        if (stream.isEmpty()) {
            log.debug("No events for stream={}", studentId);
            return Optional.empty();
        }
        metrics.incrementReplays();
        Student student = projector.fold(stream.replay());
        log.debug("Replayed {} events for stream={}", stream.size(), studentId);
        return Optional.of(student);
    }

    @Override
    public Optional<Student> getProjection(StudentId studentId) {
        Optional<Student> cached = readCache(studentId);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<Student> stored = backend.getProjectionRecord(studentId).map(codec::decodeProjection);
        stored.ifPresent(student -> backfillCache(studentId, student));
        return stored;
    }

    /**
     * Caches a projection read on a miss. An append that committed in the meantime may have evicted
     * its own entry after a failed cache write, so the stored version is checked again after the put
     * and the back-filled entry is dropped if it is already behind.
     */
    private void backfillCache(StudentId studentId, Student student) {
        refreshCache(studentId, student);
        long storedVersion;
        try {
            storedVersion = backend.getProjectionRecord(studentId)
                .map(ProjectionRecord::version)
                .orElse(student.version());
        } catch (BackendUnavailableException e) {
            log.warn("Cannot confirm back-filled projection of stream={}, evicting: {}", studentId, e.getMessage());
            evictQuietly(studentId);
            return;
        }
        if (storedVersion > student.version()) {
            log.debug("Stream={} moved to version {} during back-fill of version {}, evicting",
                studentId, storedVersion, student.version());
            evictQuietly(studentId);
        }
    }

    @Override
    public List<StudentEvent> getHistory(StudentId studentId) {
        return loadStream(studentId).replay();
    }

    @Override
    public boolean isProjectionConsistent(StudentId studentId) {
        Optional<Student> projection = getProjection(studentId);
        Optional<Student> replayed = getAggregate(studentId);
        if (!projection.equals(replayed)) {
            log.warn("Projection of stream={} diverges from replay: projection={}, replay={}",
                studentId, projection.orElse(null), replayed.orElse(null));
            return false;
        }
        return true;
    }

    private EventStream loadStream(StudentId studentId) {
        List<StoredEvent> events = backend.getStreamRecords(studentId).stream()
            .map(codec::decodeEvent)
            .toList();
        return EventStream.of(studentId, events);
    }

    private Optional<Student> readCache(StudentId studentId) {
        try {
            return projectionCache.get(studentId);
        } catch (RuntimeException e) {
            log.warn("Projection cache read failed for stream={}, reading from backend: {}", studentId, e.getMessage());
            return Optional.empty();
        }
    }

    private void refreshCache(StudentId streamId, Student student) {
        try {
            projectionCache.put(streamId, student);
        } catch (RuntimeException e) {
            log.warn("Projection cache update failed for stream={}, evicting: {}", streamId, e.getMessage());
            evictQuietly(streamId);
        }
    }

    private void evictQuietly(StudentId streamId) {
        try {
            projectionCache.evict(streamId);
        } catch (RuntimeException e) {
            log.error("Projection cache for stream={} may be stale", streamId, e);
        }
    }

    /**
     * Current time, held at {@code lastEventAt} when the clock has stepped back, so that replay
     * order by timestamp stays the order the projection folded in. Ties fall back to the sequence.
     */
    private Instant stampAfter(Instant lastEventAt) {
        // backends keep microseconds at most
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        if (lastEventAt != null && now.isBefore(lastEventAt)) {
            log.warn("Clock is behind the stream's last event by {}, stamping at {}",
                Duration.between(now, lastEventAt), lastEventAt);
            return lastEventAt;
        }
        return now;
    }
}
