package com.baykanat.bloganalytics.domain.time;

import com.baykanat.bloganalytics.domain.model.Granularity;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Tarih aralığının uzunluğuna göre granularity önerir: &lt;=7 gün day, 8-30 week, 31-365 month, &gt;365 year.
 * Tavsiye niteliğindedir, asla exception fırlatmaz.
 */
@Slf4j
public final class GranularityAdvisor {

    private GranularityAdvisor() {
    }

    /** Eksik sınır → month; bitiş başlangıçtan önce ya da eşit → day. */
    public static Granularity select(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            log.debug("Start or end date missing, defaulting to 'month' granularity");
            return Granularity.MONTH;
        }
        long days = ChronoUnit.DAYS.between(start, end);
        if (days <= 0) {
            log.warn("Non-positive date range: start={}, end={}, defaulting to 'day'", start, end);
            return Granularity.DAY;
        }
        Granularity granularity;
        if (days <= 7) {
            granularity = Granularity.DAY;
        } else if (days <= 30) {
            granularity = Granularity.WEEK;
        } else if (days <= 365) {
            granularity = Granularity.MONTH;
        } else {
            granularity = Granularity.YEAR;
        }
        log.debug("Date range: {} days, selected granularity: {}", days, granularity.getToken());
        return granularity;
    }

    /** ISO tarih string'leri için; parse edilemeyen girdi → month. */
    public static Granularity select(String start, String end) {
        try {
            return select(start == null || start.isBlank() ? null : LocalDate.parse(start),
                    end == null || end.isBlank() ? null : LocalDate.parse(end));
        } catch (DateTimeParseException e) {
            log.warn("Invalid date format: {}, defaulting to 'month' granularity", e.getMessage());
            return Granularity.MONTH;
        }
    }
}
