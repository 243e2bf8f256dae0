package com.eventsourcing.application.port.out;

import com.eventsourcing.domain.model.StudentId;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Key formats shared by every backend.
 */
public final class RecordKeys {

    private static final String VIEW_SUFFIX = "_view";

    // Fixed width so that lexical order of sort keys equals chronological order
    private static final DateTimeFormatter SORT_KEY_FORMAT = DateTimeFormatter
        .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'")
        .withZone(ZoneOffset.UTC);

    private RecordKeys() {}

    public static String eventPartitionKey(StudentId streamId) {
        return streamId.toString();
    }

    public static String projectionKey(StudentId streamId) {
        return streamId + VIEW_SUFFIX;
    }

    public static String sortKey(Instant createdAt) {
        return SORT_KEY_FORMAT.format(createdAt.truncatedTo(ChronoUnit.MICROS));
    }

    public static Instant parseSortKey(String sortKey) {
        return Instant.parse(sortKey);
    }
}
