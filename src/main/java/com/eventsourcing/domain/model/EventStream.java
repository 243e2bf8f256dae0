package com.eventsourcing.domain.model;

import com.eventsourcing.domain.event.StudentEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Append-only, ordered sequence of events for one stream.
 * Ordered by createdAt ascending, then by sequence, whatever order events arrive in.
 */
public final class EventStream {

    public static final Comparator<StoredEvent> ORDER = Comparator
        .comparing((StoredEvent stored) -> stored.event().createdAt())
        .thenComparingLong(StoredEvent::sequence);

    private final StudentId streamId;
    private final List<StoredEvent> events = new ArrayList<>();

    private EventStream(StudentId streamId) {
        this.streamId = Objects.requireNonNull(streamId, "streamId");
    }

    public static EventStream of(StudentId streamId) {
        return new EventStream(streamId);
    }

    public static EventStream of(StudentId streamId, Iterable<StoredEvent> events) {
        EventStream stream = new EventStream(streamId);
        for (StoredEvent event : events) {
            stream.appendToStream(event);
        }
        return stream;
    }

    public void appendToStream(StoredEvent stored) {
        if (!streamId.equals(stored.streamId())) {
            throw new IllegalArgumentException(
                "Event for stream " + stored.streamId() + " cannot be appended to stream " + streamId);
        }
        int index = Collections.binarySearch(events, stored, ORDER);
        if (index >= 0) {
            throw new IllegalArgumentException(
                "Stream " + streamId + " already holds an event at sequence " + stored.sequence());
        }
        events.add(-index - 1, stored);
    }

    public List<StudentEvent> replay() {
        return events.stream().map(StoredEvent::event).toList();
    }

    public StudentId streamId() {
        return streamId;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }
}
