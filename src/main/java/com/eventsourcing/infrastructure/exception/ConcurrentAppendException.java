package com.eventsourcing.infrastructure.exception;

import com.eventsourcing.domain.model.StudentId;

/**
 * Another writer appended to the stream between our projection read and our write.
 * The caller must re-run the read-fold-write cycle.
 */
public class ConcurrentAppendException extends EventStoreException {

    private final StudentId streamId;
    private final long expectedVersion;

    public ConcurrentAppendException(StudentId streamId, long expectedVersion) {
        this(streamId, expectedVersion, null);
    }

    public ConcurrentAppendException(StudentId streamId, long expectedVersion, Throwable cause) {
        super("CONCURRENT_MODIFICATION",
            "Stream " + streamId + " was modified concurrently, expected version " + expectedVersion,
            cause);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
    }

    public StudentId getStreamId() {
        return streamId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
