package com.eventsourcing.application.service;

import com.eventsourcing.application.port.out.MetricsPort;
import com.eventsourcing.domain.event.StudentCreated;
import com.eventsourcing.domain.event.StudentEvent;
import com.eventsourcing.domain.event.UnrecognizedEvent;
import com.eventsourcing.domain.model.DuplicateCreatedPolicy;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.UnknownEventPolicy;
import com.eventsourcing.infrastructure.exception.DuplicateCreationException;
import com.eventsourcing.infrastructure.exception.UnknownEventTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds events into Student state under the configured unknown-event and duplicate-creation policies.
 * Used by both the append path (one event onto the stored projection) and the replay path.
 */
public class StudentProjector {

    private static final Logger log = LoggerFactory.getLogger(StudentProjector.class);

    private final UnknownEventPolicy unknownEventPolicy;
    private final DuplicateCreatedPolicy duplicateCreatedPolicy;
    private final MetricsPort metrics;

    public StudentProjector(
            UnknownEventPolicy unknownEventPolicy,
            DuplicateCreatedPolicy duplicateCreatedPolicy,
            MetricsPort metrics) {
        this.unknownEventPolicy = unknownEventPolicy;
        this.duplicateCreatedPolicy = duplicateCreatedPolicy;
        this.metrics = metrics;
    }

    /**
     * Folds one event into {@code state} in place and returns it.
     */
    public Student project(Student state, StudentEvent event) {
        if (event instanceof UnrecognizedEvent unknown) {
            if (unknownEventPolicy == UnknownEventPolicy.STRICT) {
                throw new UnknownEventTypeException(unknown.streamId(), unknown.eventType());
            }
            log.warn("Skipping unknown event type '{}' on stream={}", unknown.eventType(), unknown.streamId());
            metrics.incrementUnknownEventsSkipped();
        } else if (event instanceof StudentCreated && state.isCreated()) {
            switch (duplicateCreatedPolicy) {
                case REJECT -> throw new DuplicateCreationException(event.streamId());
                case IGNORE -> {
                    log.debug("Ignoring repeated StudentCreated on stream={}", event.streamId());
                    state.skip(event);
                    return state;
                }
                case LAST_WRITE_WINS -> log.debug("Repeated StudentCreated overwrites stream={}", event.streamId());
            }
        }
        state.apply(event);
        return state;
    }

    /**
     * Folds a whole ordered stream starting from {@link Student#empty()}.
     */
    public Student fold(Iterable<? extends StudentEvent> events) {
        Student state = Student.empty();
        for (StudentEvent event : events) {
            project(state, event);
        }
        return state;
    }

    public UnknownEventPolicy getUnknownEventPolicy() {
        return unknownEventPolicy;
    }

    public DuplicateCreatedPolicy getDuplicateCreatedPolicy() {
        return duplicateCreatedPolicy;
    }
}
