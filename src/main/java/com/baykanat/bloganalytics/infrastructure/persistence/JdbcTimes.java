package com.baykanat.bloganalytics.infrastructure.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/** TIMESTAMPTZ ↔ Instant dönüşümleri; JVM saat diliminden bağımsız olması için OffsetDateTime (UTC) kullanılır. */
final class JdbcTimes {

    private JdbcTimes() {
    }

    static OffsetDateTime toDb(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    /** Nullable BIGINT kolonu. */
    static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    /** date_trunc ifadesi; unit enum'dan gelir, kullanıcı girdisi değildir. */
    static String truncUtc(String unit, String column) {
        return String.format("(date_trunc('%s', %s AT TIME ZONE 'UTC') AT TIME ZONE 'UTC')", unit, column);
    }
}
