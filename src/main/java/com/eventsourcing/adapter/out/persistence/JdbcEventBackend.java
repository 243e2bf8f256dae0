package com.eventsourcing.adapter.out.persistence;

import com.eventsourcing.application.port.out.EventBackend;
import com.eventsourcing.application.port.out.EventRecord;
import com.eventsourcing.application.port.out.ProjectionRecord;
import com.eventsourcing.application.port.out.RecordKeys;
import com.eventsourcing.domain.model.StudentId;
import com.eventsourcing.infrastructure.config.AppProperties;
import com.eventsourcing.infrastructure.exception.BackendUnavailableException;
import com.eventsourcing.infrastructure.exception.ConcurrentAppendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL backend. Events and projections are JSONB documents in two tables; the pair write
 * runs in one transaction so the event row and the projection row commit or roll back together.
 * <p>
 * The projection write is conditional: insert when no projection is expected, otherwise update
 * only the row still at the expected version. A lost race shows up as a duplicate key or as zero
 * updated rows, both reported as {@link ConcurrentAppendException}.
 */
@Repository
@ConditionalOnProperty(prefix = "app.event-store", name = "backend", havingValue = "jdbc", matchIfMissing = true)
public class JdbcEventBackend implements EventBackend {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventBackend.class);

    private static final RowMapper<EventRecord> EVENT_ROW_MAPPER = (rs, rowNum) -> new EventRecord(
        rs.getString("pk"),
        rs.getString("sk"),
        rs.getLong("sequence"),
        rs.getString("event_type"),
        rs.getString("payload")
    );

    private static final RowMapper<ProjectionRecord> PROJECTION_ROW_MAPPER = (rs, rowNum) -> new ProjectionRecord(
        rs.getString("pk"),
        rs.getString("sk"),
        rs.getLong("version"),
        rs.getString("payload")
    );

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public JdbcEventBackend(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            AppProperties appProperties) {
        int timeoutSeconds = (int) Math.max(1, appProperties.getEventStore().getBackendTimeout().toSeconds());

        // Own template so the statement timeout does not leak into other users of the shared one
        this.jdbc = new JdbcTemplate(jdbcTemplate.getDataSource());
        this.jdbc.setExceptionTranslator(jdbcTemplate.getExceptionTranslator());
        this.jdbc.setQueryTimeout(timeoutSeconds);

        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setTimeout(timeoutSeconds);
    }

    @Override
    public void putDurablePair(EventRecord event, ProjectionRecord projection, long expectedVersion) {
        StudentId streamId = StudentId.fromTrusted(event.partitionKey());
        try {
            transactionTemplate.executeWithoutResult(status -> {
                writeProjection(streamId, projection, expectedVersion);
                jdbc.update("""
                    INSERT INTO student_events (pk, sk, sequence, event_type, payload)
                    VALUES (?, ?, ?, ?, ?::jsonb)
                    """,
                    event.partitionKey(),
                    event.sortKey(),
                    event.sequence(),
                    event.eventType(),
                    event.payload()
                );
            });
            log.debug("Committed event {} and projection version {} for stream={}",
                event.sequence(), projection.version(), streamId);
        } catch (DuplicateKeyException e) {
            throw new ConcurrentAppendException(streamId, expectedVersion, e);
        } catch (DataAccessException | TransactionException e) {
            throw new BackendUnavailableException("Failed to store event for stream " + streamId, e);
        }
    }

    private void writeProjection(StudentId streamId, ProjectionRecord projection, long expectedVersion) {
        if (expectedVersion == 0) {
            jdbc.update("""
                INSERT INTO student_views (pk, sk, version, payload)
                VALUES (?, ?, ?, ?::jsonb)
                """,
                projection.partitionKey(),
                projection.sortKey(),
                projection.version(),
                projection.payload()
            );
            return;
        }
        int updated = jdbc.update("""
            UPDATE student_views
            SET version = ?, payload = ?::jsonb
            WHERE pk = ? AND version = ?
            """,
            projection.version(),
            projection.payload(),
            projection.partitionKey(),
            expectedVersion
        );
        if (updated == 0) {
            throw new ConcurrentAppendException(streamId, expectedVersion);
        }
    }

    @Override
    public Optional<ProjectionRecord> getProjectionRecord(StudentId streamId) {
        try {
            return jdbc.query(
                "SELECT pk, sk, version, payload FROM student_views WHERE pk = ?",
                PROJECTION_ROW_MAPPER,
                RecordKeys.projectionKey(streamId)
            ).stream().findFirst();
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Failed to read projection of stream " + streamId, e);
        }
    }

    @Override
    public List<EventRecord> getStreamRecords(StudentId streamId) {
        try {
            return jdbc.query("""
                SELECT pk, sk, sequence, event_type, payload
                FROM student_events
                WHERE pk = ?
                ORDER BY sk, sequence
                """,
                EVENT_ROW_MAPPER,
                RecordKeys.eventPartitionKey(streamId)
            );
        } catch (DataAccessException e) {
            throw new BackendUnavailableException("Failed to read events of stream " + streamId, e);
        }
    }
}
