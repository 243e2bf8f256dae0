package com.eventsourcing.application.port.out;

/**
 * An event as the backend stores it.
 *
 * @param partitionKey the stream id
 * @param sortKey      the event's createdAt in {@link RecordKeys#sortKey} format
 * @param sequence     1-based position in the stream, unique per partition
 * @param eventType    wire name of the event variant
 * @param payload      JSON document of the event
 */
public record EventRecord(
    String partitionKey,
    String sortKey,
    long sequence,
    String eventType,
    String payload
) {}
