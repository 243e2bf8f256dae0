package com.eventsourcing.adapter.out.persistence;

import com.eventsourcing.application.port.out.EventBackend;
import com.eventsourcing.application.port.out.EventRecord;
import com.eventsourcing.application.port.out.ProjectionRecord;
import com.eventsourcing.application.port.out.RecordKeys;
import com.eventsourcing.domain.model.StudentId;
import com.eventsourcing.infrastructure.exception.ConcurrentAppendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local backend: one sorted list of event records per stream plus one projection record per stream.
 * A single lock makes the pair write atomic and the version check exact.
 */
@Repository
@ConditionalOnProperty(prefix = "app.event-store", name = "backend", havingValue = "in-memory")
public class InMemoryEventBackend implements EventBackend {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBackend.class);

    private static final Comparator<EventRecord> RECORD_ORDER = Comparator
        .comparing(EventRecord::sortKey)
        .thenComparingLong(EventRecord::sequence);

    private final Map<String, List<EventRecord>> streams = new HashMap<>();
    private final Map<String, ProjectionRecord> projections = new HashMap<>();

    @Override
    public synchronized void putDurablePair(EventRecord event, ProjectionRecord projection, long expectedVersion) {
        StudentId streamId = StudentId.fromTrusted(event.partitionKey());
        if (!RecordKeys.projectionKey(streamId).equals(projection.partitionKey())) {
            throw new IllegalArgumentException(
                "Projection " + projection.partitionKey() + " does not belong to stream " + streamId);
        }

        ProjectionRecord current = projections.get(projection.partitionKey());
        long currentVersion = current == null ? 0L : current.version();
        if (currentVersion != expectedVersion) {
            log.debug("Version mismatch on stream={}: expected={}, actual={}", streamId, expectedVersion, currentVersion);
            throw new ConcurrentAppendException(streamId, expectedVersion);
        }

        List<EventRecord> stream = streams.computeIfAbsent(event.partitionKey(), key -> new ArrayList<>());
        if (stream.stream().anyMatch(stored -> stored.sequence() == event.sequence())) {
            throw new ConcurrentAppendException(streamId, expectedVersion);
        }

        // Both checks passed, nothing below can fail
        int index = Collections.binarySearch(stream, event, RECORD_ORDER);
        stream.add(index < 0 ? -index - 1 : index, event);
        projections.put(projection.partitionKey(), projection);
    }

    @Override
    public synchronized Optional<ProjectionRecord> getProjectionRecord(StudentId streamId) {
        return Optional.ofNullable(projections.get(RecordKeys.projectionKey(streamId)));
    }

    @Override
    public synchronized List<EventRecord> getStreamRecords(StudentId streamId) {
        List<EventRecord> stream = streams.get(RecordKeys.eventPartitionKey(streamId));
        return stream == null ? List.of() : List.copyOf(stream);
    }
}
