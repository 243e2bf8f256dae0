package com.eventsourcing.domain.model;

/**
 * What folding does with an event type this build does not recognize.
 */
public enum UnknownEventPolicy {
    /** Skip the event and keep folding. */
    PERMISSIVE,
    /** Fail the fold. */
    STRICT
}
