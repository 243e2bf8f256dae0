package com.eventsourcing.application.port.out;

import java.util.UUID;

/**
 * Source of new stream identifiers.
 */
public interface IdGenerator {

    /**
     * Generates a new unique identifier.
     * Implementations should ensure time-ordering (e.g., UUIDv7).
     */
    UUID generate();
}
