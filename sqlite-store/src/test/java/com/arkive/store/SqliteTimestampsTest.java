package com.arkive.store;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SqliteTimestampsTest {

    @Test
    void formatTruncatesToMillis() {
        assertEquals("2024-03-01T10:00:00.123Z", SqliteTimestamps.format(Instant.parse("2024-03-01T10:00:00.123999Z")));
    }

    @Test
    void formatCeilingRoundsSubMillisecondUp() {
        assertEquals("2024-03-01T10:00:00.001Z", SqliteTimestamps.formatCeiling(Instant.parse("2024-03-01T10:00:00.000500Z")));
        assertEquals("2024-03-01T10:00:01.000Z", SqliteTimestamps.formatCeiling(Instant.parse("2024-03-01T10:00:00.999000001Z")));
    }

    @Test
    void formatCeilingKeepsWholeMillis() {
        assertEquals("2024-03-01T10:00:00.000Z", SqliteTimestamps.formatCeiling(Instant.parse("2024-03-01T10:00:00Z")));
        assertNull(SqliteTimestamps.formatCeiling(null));
    }
}
