package com.eventsourcing.domain.model;

/**
 * What folding does with a StudentCreated event arriving on a stream that was already created.
 */
public enum DuplicateCreatedPolicy {
    /** The later event overwrites id, name, email and date of birth. */
    LAST_WRITE_WINS,
    /** The later event is counted but changes nothing. */
    IGNORE,
    /** The fold fails. */
    REJECT
}
