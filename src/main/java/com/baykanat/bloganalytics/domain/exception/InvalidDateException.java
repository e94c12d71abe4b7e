package com.baykanat.bloganalytics.domain.exception;

/** Sorgu isteğinde parse edilemeyen tarih sınırı. */
public class InvalidDateException extends AnalyticsRequestException {

    public InvalidDateException(String field, String value, Throwable cause) {
        super("INVALID_DATE", "Invalid date for '" + field + "': " + value + " (expected yyyy-MM-dd)", cause);
    }
}
