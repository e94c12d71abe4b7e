package com.baykanat.bloganalytics.domain.time;

import com.baykanat.bloganalytics.domain.exception.InvalidDateException;
import com.baykanat.bloganalytics.domain.model.TimeRange;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/** İstekteki yyyy-MM-dd tarih sınırlarını çözer; boş değer sınır yok demektir. */
public final class RequestDates {

    private RequestDates() {
    }

    public static LocalDate parse(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidDateException(field, value, e);
        }
    }

    /** Ters aralık hata değildir, boş sonuç verir. */
    public static TimeRange range(String start, String end) {
        return new TimeRange(parse("start", start), parse("end", end));
    }
}
