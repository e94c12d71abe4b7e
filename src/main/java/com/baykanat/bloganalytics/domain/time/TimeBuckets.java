package com.baykanat.bloganalytics.domain.time;

import com.baykanat.bloganalytics.domain.exception.UnsupportedGranularityException;
import com.baykanat.bloganalytics.domain.model.Granularity;
import com.baykanat.bloganalytics.domain.model.PeriodBounds;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Objects;

/**
 * Bucket hesapları. Tüm aritmetik UTC'dir; aynı girdi her zaman aynı bucket'ı verir ve
 * t1 &lt;= t2 ise bucketStart(t1) &lt;= bucketStart(t2).
 */
public final class TimeBuckets {

    private static final DateTimeFormatter HOUR_LABEL = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:00");
    private static final DateTimeFormatter DAY_LABEL = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final DateTimeFormatter YEAR_LABEL = DateTimeFormatter.ofPattern("yyyy");

    private TimeBuckets() {
    }

    /** Timestamp'i içinde bulunduğu birimin başına keser: hour, day (gece yarısı), ISO hafta (pazartesi), ayın 1'i, 1 Ocak. */
    public static Instant bucketStart(Instant timestamp, Granularity granularity) {
        Objects.requireNonNull(timestamp, "timestamp");
        ZonedDateTime utc = timestamp.atZone(ZoneOffset.UTC);
        ZonedDateTime truncated = switch (granularity) {
            case HOUR -> utc.truncatedTo(ChronoUnit.HOURS);
            case DAY -> utc.truncatedTo(ChronoUnit.DAYS);
            case WEEK -> utc.truncatedTo(ChronoUnit.DAYS)
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> utc.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
            case YEAR -> utc.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1);
            case RAW -> throw new UnsupportedGranularityException(granularity.getToken());
        };
        return truncated.toInstant();
    }

    /** Bir bucket başlangıcından sonraki bucket'ın başlangıcı (takvime duyarlı). */
    public static Instant nextBucket(Instant bucketStart, Granularity granularity) {
        ZonedDateTime utc = bucketStart.atZone(ZoneOffset.UTC);
        ZonedDateTime next = switch (granularity) {
            case HOUR -> utc.plusHours(1);
            case DAY -> utc.plusDays(1);
            case WEEK -> utc.plusWeeks(1);
            case MONTH -> utc.plusMonths(1);
            case YEAR -> utc.plusYears(1);
            case RAW -> throw new UnsupportedGranularityException(granularity.getToken());
        };
        return next.toInstant();
    }

    /** Bir bucket başlangıcından önceki bucket'ın başlangıcı (takvime duyarlı). */
    public static Instant previousBucket(Instant bucketStart, Granularity granularity) {
        ZonedDateTime utc = bucketStart.atZone(ZoneOffset.UTC);
        ZonedDateTime previous = switch (granularity) {
            case HOUR -> utc.minusHours(1);
            case DAY -> utc.minusDays(1);
            case WEEK -> utc.minusWeeks(1);
            case MONTH -> utc.minusMonths(1);
            case YEAR -> utc.minusYears(1);
            case RAW -> throw new UnsupportedGranularityException(granularity.getToken());
        };
        return previous.toInstant();
    }

    /** now'ın içinde bulunduğu periyottan hemen önceki tek periyodun [start, end) penceresi. */
    public static PeriodBounds previousPeriodBounds(Instant now, Granularity granularity) {
        Instant currentStart = bucketStart(now, granularity);
        return PeriodBounds.builder()
                .start(previousBucket(currentStart, granularity))
                .end(currentStart)
                .build();
    }

    /** Periyot etiketi: saat yyyy-MM-dd'T'HH:00, gün yyyy-MM-dd, hafta YYYY-Www, ay yyyy-MM, yıl yyyy. */
    public static String formatPeriod(Instant bucketStart, Granularity granularity) {
        ZonedDateTime utc = bucketStart.atZone(ZoneOffset.UTC);
        return switch (granularity) {
            case HOUR -> HOUR_LABEL.format(utc);
            case DAY -> DAY_LABEL.format(utc);
            case WEEK -> String.format("%d-W%02d",
                    utc.get(IsoFields.WEEK_BASED_YEAR), utc.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTH -> MONTH_LABEL.format(utc);
            case YEAR -> YEAR_LABEL.format(utc);
            case RAW -> utc.toInstant().toString();
        };
    }
}
