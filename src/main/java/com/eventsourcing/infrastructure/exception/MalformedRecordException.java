package com.eventsourcing.infrastructure.exception;

public class MalformedRecordException extends EventStoreException {

    public MalformedRecordException(String partitionKey, String sortKey, Throwable cause) {
        super("MALFORMED_RECORD", "Cannot decode stored record " + partitionKey + "/" + sortKey, cause);
    }
}
