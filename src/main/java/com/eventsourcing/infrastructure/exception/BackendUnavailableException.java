package com.eventsourcing.infrastructure.exception;

/**
 * The storage backend could not be reached or did not answer in time.
 * Nothing was written, so the call can be retried as is.
 */
public class BackendUnavailableException extends EventStoreException {

    public BackendUnavailableException(String message, Throwable cause) {
        super("BACKEND_UNAVAILABLE", message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
