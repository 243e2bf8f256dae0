package com.eventsourcing.application.port.out;

/**
 * The materialized view of one stream as the backend stores it. There is one per stream:
 * partition and sort key are both {@code "{streamId}_view"}.
 *
 * @param version number of events folded into the payload
 */
public record ProjectionRecord(
    String partitionKey,
    String sortKey,
    long version,
    String payload
) {}
