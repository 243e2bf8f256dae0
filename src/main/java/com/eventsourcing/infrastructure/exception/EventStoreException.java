package com.eventsourcing.infrastructure.exception;

/**
 * Base for failures of the event store and its backends.
 * Each carries a stable error code and says whether retrying the same call can succeed.
 */
public abstract class EventStoreException extends RuntimeException {

    private final String errorCode;

    protected EventStoreException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected EventStoreException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return false;
    }
}
