package com.eventsourcing.adapter.out.persistence;

import com.eventsourcing.application.port.out.EventRecord;
import com.eventsourcing.application.port.out.ProjectionRecord;
import com.eventsourcing.application.port.out.RecordCodec;
import com.eventsourcing.application.port.out.RecordKeys;
import com.eventsourcing.domain.event.StudentCreated;
import com.eventsourcing.domain.event.StudentEnrolled;
import com.eventsourcing.domain.event.StudentEvent;
import com.eventsourcing.domain.event.StudentUnenrolled;
import com.eventsourcing.domain.event.StudentUpdated;
import com.eventsourcing.domain.event.UnrecognizedEvent;
import com.eventsourcing.domain.model.StoredEvent;
import com.eventsourcing.domain.model.Student;
import com.eventsourcing.domain.model.StudentId;
import com.eventsourcing.infrastructure.exception.MalformedRecordException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.deser.std.FromStringDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * JSON documents for events and projections. Every document repeats its own {@code pk}/{@code sk}
 * so that a stored item is self-describing.
 */
@Component
public class JacksonRecordCodec implements RecordCodec {

    private static final Map<String, Class<? extends StudentEvent>> EVENT_TYPES = Map.of(
        StudentCreated.TYPE, StudentCreated.class,
        StudentUpdated.TYPE, StudentUpdated.class,
        StudentEnrolled.TYPE, StudentEnrolled.class,
        StudentUnenrolled.TYPE, StudentUnenrolled.class
    );

    private final ObjectMapper objectMapper;

    public JacksonRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .registerModule(studentIdModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public EventRecord encodeEvent(StoredEvent stored) {
        StudentEvent event = stored.event();
        if (event instanceof UnrecognizedEvent) {
            throw new IllegalArgumentException("Unrecognized events are never encoded");
        }
        String partitionKey = RecordKeys.eventPartitionKey(event.streamId());
        String sortKey = RecordKeys.sortKey(event.createdAt());

        ObjectNode document = objectMapper.valueToTree(event);
        document.put("pk", partitionKey);
        document.put("sk", sortKey);
        document.put("type", event.eventType());
        return new EventRecord(partitionKey, sortKey, stored.sequence(), event.eventType(), write(document));
    }

    @Override
    public StoredEvent decodeEvent(EventRecord record) {
        try {
            StudentId streamId = StudentId.fromTrusted(record.partitionKey());
            var createdAt = RecordKeys.parseSortKey(record.sortKey());
            Class<? extends StudentEvent> type = EVENT_TYPES.get(record.eventType());
            if (type == null) {
                var unknown = new UnrecognizedEvent(streamId, record.eventType(), record.payload(), createdAt);
                return new StoredEvent(unknown, record.sequence());
            }
            StudentEvent event = objectMapper.readValue(record.payload(), type);
            if (!streamId.equals(event.streamId())) {
                throw new IllegalStateException("Event of stream " + event.streamId() + " stored under " + streamId);
            }
            return new StoredEvent(event.withCreatedAt(createdAt), record.sequence());
        } catch (JsonProcessingException | DateTimeParseException | IllegalStateException | IllegalArgumentException e) {
            throw new MalformedRecordException(record.partitionKey(), record.sortKey(), e);
        }
    }

    @Override
    public ProjectionRecord encodeProjection(StudentId streamId, Student student) {
        String key = RecordKeys.projectionKey(streamId);
        var document = new StudentDocument(
            key,
            key,
            student.id() == null ? null : student.id().toString(),
            student.fullName(),
            student.email(),
            student.enrolledCourses(),
            student.dateOfBirth(),
            student.version(),
            student.lastEventAt()
        );
        return new ProjectionRecord(key, key, student.version(), write(document));
    }

    @Override
    public Student decodeProjection(ProjectionRecord record) {
        try {
            StudentDocument document = objectMapper.readValue(record.payload(), StudentDocument.class);
            if (document.version() != record.version()) {
                throw new IllegalStateException(
                    "Projection document version " + document.version() + " differs from record version " + record.version());
            }
            return Student.restore(
                document.id() == null ? null : StudentId.fromTrusted(document.id()),
                document.fullName(),
                document.email(),
                document.enrolledCourses(),
                document.dateOfBirth(),
                document.version(),
                document.lastEventAt()
            );
        } catch (JsonProcessingException | IllegalStateException | IllegalArgumentException e) {
            throw new MalformedRecordException(record.partitionKey(), record.sortKey(), e);
        }
    }

    private String write(Object document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize record", e);
        }
    }

    private static SimpleModule studentIdModule() {
        SimpleModule module = new SimpleModule("student-id");
        module.addSerializer(StudentId.class, ToStringSerializer.instance);
        module.addDeserializer(StudentId.class, new FromStringDeserializer<>(StudentId.class) {
            @Override
            protected StudentId _deserialize(String value, DeserializationContext context) {
                return StudentId.fromTrusted(value);
            }
        });
        return module;
    }

    record StudentDocument(
        String pk,
        String sk,
        String id,
        String fullName,
        String email,
        List<String> enrolledCourses,
        LocalDate dateOfBirth,
        long version,
        Instant lastEventAt
    ) {}
}
