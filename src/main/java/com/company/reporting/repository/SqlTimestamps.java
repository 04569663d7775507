package com.company.reporting.repository;

import java.sql.Timestamp;
import java.time.Instant;

final class SqlTimestamps {

    private SqlTimestamps() {
    }

    static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
